package com.propertyintel.price.exception;

/**
 * A category value was not seen when the encoding for this run was derived.
 */
public class UnknownCategoryException extends PricePredictionException {

    public UnknownCategoryException(String column, String value) {
        super("UNKNOWN_CATEGORY",
                String.format("Value '%s' of column '%s' was not present in the training data", value, column));
    }
}
