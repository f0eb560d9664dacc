package com.propertyintel.price.exception;

public class InsufficientTrainingDataException extends PricePredictionException {

    public InsufficientTrainingDataException(String message) {
        super("INSUFFICIENT_DATA", message);
    }
}
