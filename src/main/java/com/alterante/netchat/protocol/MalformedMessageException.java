package com.alterante.netchat.protocol;

/**
 * Thrown when a message cannot be decoded.
 */
public class MalformedMessageException extends Exception {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
