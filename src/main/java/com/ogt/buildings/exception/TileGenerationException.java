package com.ogt.buildings.exception;

public class TileGenerationException extends RuntimeException {

    public TileGenerationException(String message) {
        super(message);
    }

    public TileGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
