package com.propertyintel.price.exception;

import lombok.Getter;

/**
 * Root of every failure the prediction pipeline can surface.
 * None of these are recovered locally; they propagate to the caller as-is.
 */
@Getter
public abstract class PricePredictionException extends RuntimeException {

    private final String errorCode;

    protected PricePredictionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected PricePredictionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
