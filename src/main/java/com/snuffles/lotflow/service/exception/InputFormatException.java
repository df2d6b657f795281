package com.snuffles.lotflow.service.exception;

/**
 * The trade input cannot be used at all, e.g. required columns are missing, the file
 * cannot be read, or a scrip's quantities add up past what a {@code long} holds.
 */
public class InputFormatException extends RuntimeException {

    public InputFormatException(String message) {
        super(message);
    }

    public InputFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
