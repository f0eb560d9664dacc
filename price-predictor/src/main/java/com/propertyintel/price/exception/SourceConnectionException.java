package com.propertyintel.price.exception;

/**
 * The record store or the POI source could not be reached.
 */
public class SourceConnectionException extends PricePredictionException {

    public SourceConnectionException(String message) {
        super("CONNECTION_ERROR", message);
    }

    public SourceConnectionException(String message, Throwable cause) {
        super("CONNECTION_ERROR", message, cause);
    }
}
