package com.codefarm.shortlink.exception;

public class InvalidCustomCodeException extends RuntimeException {

    public InvalidCustomCodeException(String code) {
        super("Custom code '" + code + "' must be 1-12 characters from [A-Za-z0-9_-]");
    }
}
