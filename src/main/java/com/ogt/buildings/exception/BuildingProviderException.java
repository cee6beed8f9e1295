package com.ogt.buildings.exception;

public class BuildingProviderException extends RuntimeException {

    public BuildingProviderException(String message) {
        super(message);
    }

    public BuildingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
