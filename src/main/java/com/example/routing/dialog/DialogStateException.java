package com.example.routing.dialog;

/** A dialog operation was requested in a state that does not allow it. */
public class DialogStateException extends RuntimeException {

    public enum Reason { NOT_FOUND, NOT_ACTIVE }

    private final Reason reason;

    public DialogStateException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
