package com.sailfish.transport.error;

/**
 * The request never produced an HTTP response (connection refused, reset, DNS failure...).
 */
public class TransportUnreachableException extends TransportException {

    private static final long serialVersionUID = 1L;

    public TransportUnreachableException(String message) {
        super(message);
    }

    public TransportUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
