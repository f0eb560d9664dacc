package com.propertyintel.price.exception;

public class NoPoiFoundException extends PricePredictionException {

    public NoPoiFoundException(String message) {
        super("NO_POI_FOUND", message);
    }
}
