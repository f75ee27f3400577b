package com.webanalytics.funnel.model;

/**
 * Raised when a funnel analytics call cannot produce a complete result.
 */
public class FunnelAnalyticsException extends RuntimeException {

    private final ErrorKind kind;

    public FunnelAnalyticsException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FunnelAnalyticsException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
