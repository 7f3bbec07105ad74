package com.lobsim.matching;

/**
 * Raised when a submission is malformed (bad quantity, bad limit price, missing
 * side, type or owner). Nothing in the book changes when this is thrown.
 */
public class InvalidOrderException extends RuntimeException {

    private final String reason;

    public InvalidOrderException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * Short machine-friendly code, e.g. {@code invalid_quantity}.
     */
    public String getReason() {
        return reason;
    }
}
