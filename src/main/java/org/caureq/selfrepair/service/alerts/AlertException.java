package org.caureq.selfrepair.service.alerts;

/** An alert could not be delivered to its sink. */
public class AlertException extends Exception {
    private final int status;

    public AlertException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    public AlertException(int status, String message) {
        super(message);
        this.status = status;
    }

    /** HTTP status returned by the sink, 0 when no response was received. */
    public int status() { return status; }
}
