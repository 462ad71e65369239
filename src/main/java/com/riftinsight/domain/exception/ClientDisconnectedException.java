package com.riftinsight.domain.exception;

/**
 * The streaming client went away; further emission is pointless.
 */
public class ClientDisconnectedException extends RuntimeException {

    public ClientDisconnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
