package com.codefarm.shortlink.exception;

public class LinkExpiredException extends RuntimeException {

    public LinkExpiredException(String code) {
        super("Short link has expired: " + code);
    }
}
