package com.example.routing.approval;

/**
 * Human-in-the-loop gate for risky operations. Notification delivery and the
 * approver UI live behind implementations of this interface.
 */
public interface ApprovalGate {

    ApprovalTicket submit(ApprovalRequest request);

    ApprovalStatus status(String requestId);
}
