package com.dbmodel.converter.exception;

/**
 * Unrecoverable failure during a conversion run. The message names the offending
 * table, column, attribute or identifier.
 */
public class ConversionException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final ConversionError error;

    public ConversionException(ConversionError error, String message) {
        super(error + ": " + message);
        this.error = error;
    }

    public ConversionException(ConversionError error, String message, Throwable cause) {
        super(error + ": " + message, cause);
        this.error = error;
    }

    public ConversionError getError() {
        return error;
    }
}
