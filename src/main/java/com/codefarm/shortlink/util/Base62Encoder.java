package com.codefarm.shortlink.util;

import org.springframework.stereotype.Component;

@Component
public class Base62Encoder {

    /**
     * Digit order is 0-9, then a-z, then A-Z: the symbol at index i stands for the digit value i.
     * Changing it re-maps every code already handed out.
     */
    static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final int BASE = ALPHABET.length();

    /**
     * Positional base62 representation of {@code number}, most significant digit first.
     * Variable-length: 1 character up to 61, 2 characters up to 3843, and never more than
     * 11 characters for any {@code long}, so generated codes always fit the 12 character column.
     *
     * @param number a non-negative sequence value
     * @return the code for {@code number}; distinct inputs always give distinct codes
     */
    public String toBase62(long number) {
        if (number < 0) {
            throw new IllegalArgumentException("Cannot encode negative value: " + number);
        }
        StringBuilder builder = new StringBuilder();
        do {
            builder.append(ALPHABET.charAt((int) (number % BASE)));
            number = number / BASE;
        } while (number > 0);
        return builder.reverse().toString();
    }
}
