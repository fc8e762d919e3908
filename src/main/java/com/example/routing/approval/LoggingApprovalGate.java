package com.example.routing.approval;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Records approval requests in memory and logs them. Requests stay pending
 * until they expire; nothing here approves or rejects. Expired requests are
 * dropped by {@link #sweepExpired()}, after which their ids are unknown.
 */
public class LoggingApprovalGate implements ApprovalGate {

    private static final Logger log = LoggerFactory.getLogger(LoggingApprovalGate.class);

    private final Map<String, ApprovalRequest> requests = new ConcurrentHashMap<>();
    private final Clock clock;

    public LoggingApprovalGate(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ApprovalTicket submit(ApprovalRequest request) {
        requests.put(request.requestId(), request);
        log.info("Approval requested: id={} correlation={} intent={}/{} risk={} type={}",
            request.requestId(), request.correlationId(),
            request.routingDecision().intentCategory().value(), request.routingDecision().subIntent(),
            request.riskAssessment().level().value(), request.approvalType().value());
        return new ApprovalTicket(request.requestId(), ApprovalStatus.PENDING, request.approvalType().value(),
            request.expiresAt());
    }

    @Override
    public ApprovalStatus status(String requestId) {
        ApprovalRequest request = requests.get(requestId);
        if (request == null) {
            throw new IllegalArgumentException("Unknown approval request: " + requestId);
        }
        if (request.isExpired(clock.instant())) {
            log.debug("Approval request {} expired without decision", requestId);
            return ApprovalStatus.EXPIRED;
        }
        return ApprovalStatus.PENDING;
    }

    /** Removes every request whose approval window has closed. */
    @Scheduled(fixedDelayString = "${app.router.approval-sweep-interval:PT5M}")
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, ApprovalRequest> entry : requests.entrySet()) {
            if (entry.getValue().isExpired(now) && requests.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Dropped {} expired approval requests", removed);
        }
        return removed;
    }

    public int size() {
        return requests.size();
    }
}
