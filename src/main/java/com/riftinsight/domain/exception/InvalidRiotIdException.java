package com.riftinsight.domain.exception;

/**
 * Riot ID is not of the form {@code name#tag}. Raised before any queue slot is taken.
 */
public class InvalidRiotIdException extends RuntimeException {

    public InvalidRiotIdException(String message) {
        super(message);
    }
}
