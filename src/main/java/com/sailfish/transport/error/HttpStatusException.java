package com.sailfish.transport.error;

/**
 * The server responded, but with an error status.
 */
public class HttpStatusException extends TransportException {

    private static final long serialVersionUID = 1L;

    private final int status;
    private final transient Object responseBody;

    public HttpStatusException(int status, String message) {
        this(status, message, null);
    }

    public HttpStatusException(int status, String message, Object responseBody) {
        super(message);
        this.status = status;
        this.responseBody = responseBody;
    }

    public int getStatus() {
        return status;
    }

    public Object getResponseBody() {
        return responseBody;
    }

    /**
     * @return true if a usable HTTP status was received (a positive status code).
     */
    public boolean hasStatus() {
        return status > 0;
    }

    @Override
    public String toString() {
        return getClass().getName() + ": status=" + status + ", " + getMessage();
    }
}
