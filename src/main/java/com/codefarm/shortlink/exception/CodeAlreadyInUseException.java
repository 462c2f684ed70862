package com.codefarm.shortlink.exception;

public class CodeAlreadyInUseException extends RuntimeException {

    private final String code;

    public CodeAlreadyInUseException(String code, Throwable cause) {
        super("Code already in use: " + code, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
