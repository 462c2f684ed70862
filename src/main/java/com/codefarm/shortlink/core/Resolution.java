package com.codefarm.shortlink.core;

/**
 * Result of resolving a code. {@code longUrl} is set only for {@link Outcome#FOUND}.
 */
public record Resolution(String code, Outcome outcome, String longUrl) {

    public enum Outcome {
        FOUND,
        NOT_FOUND,
        GONE
    }

    public static Resolution found(String code, String longUrl) {
        return new Resolution(code, Outcome.FOUND, longUrl);
    }

    public static Resolution notFound(String code) {
        return new Resolution(code, Outcome.NOT_FOUND, null);
    }

    public static Resolution gone(String code) {
        return new Resolution(code, Outcome.GONE, null);
    }
}
