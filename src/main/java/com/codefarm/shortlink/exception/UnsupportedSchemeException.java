package com.codefarm.shortlink.exception;

public class UnsupportedSchemeException extends RuntimeException {

    public UnsupportedSchemeException(String scheme) {
        super("Unsupported URL scheme '" + scheme + "': only http and https are allowed");
    }
}
