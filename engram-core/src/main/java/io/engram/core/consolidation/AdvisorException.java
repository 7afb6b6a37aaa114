package io.engram.core.consolidation;

public final class AdvisorException extends Exception {
    public AdvisorException(String message) {
        super(message);
    }

    public AdvisorException(String message, Throwable cause) {
        super(message, cause);
    }
}
