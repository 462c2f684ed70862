package com.codefarm.shortlink.exception;

public class UrlNotFoundException extends RuntimeException {

    public UrlNotFoundException(String code) {
        super("Short code not found: " + code);
    }
}
