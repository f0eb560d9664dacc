package com.propertyintel.price.exception;

public class InvalidQueryException extends PricePredictionException {

    public InvalidQueryException(String message) {
        super("QUERY_ERROR", message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super("QUERY_ERROR", message, cause);
    }
}
