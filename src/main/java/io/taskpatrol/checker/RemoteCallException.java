package io.taskpatrol.checker;

/**
 * Failure reported by the remote provider or the transport. {@code httpStatus} is 0 when no response
 * was received.
 */
public final class RemoteCallException extends Exception {
    private final String errorCode;
    private final int httpStatus;
    private final boolean timeout;

    public RemoteCallException(String errorCode, int httpStatus, String message) {
        this(errorCode, httpStatus, false, message, null);
    }

    public RemoteCallException(String errorCode, int httpStatus, boolean timeout, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
        this.timeout = timeout;
    }

    public String errorCode() {
        return errorCode;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean timeout() {
        return timeout;
    }
}
