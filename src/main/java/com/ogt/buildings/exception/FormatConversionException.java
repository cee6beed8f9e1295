package com.ogt.buildings.exception;

public class FormatConversionException extends RuntimeException {

    public FormatConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
