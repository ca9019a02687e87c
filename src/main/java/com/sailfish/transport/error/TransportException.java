package com.sailfish.transport.error;

/**
 * Base type of the failures a transport delivers through its result futures.
 *
 * Two variants exist: {@link TransportUnreachableException} when no HTTP response was
 * received, and {@link HttpStatusException} when the server answered with an error status.
 */
public class TransportException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
