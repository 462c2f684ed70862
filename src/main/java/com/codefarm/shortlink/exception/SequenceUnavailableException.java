package com.codefarm.shortlink.exception;

public class SequenceUnavailableException extends RuntimeException {

    public SequenceUnavailableException(String message) {
        super(message);
    }

    public SequenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
