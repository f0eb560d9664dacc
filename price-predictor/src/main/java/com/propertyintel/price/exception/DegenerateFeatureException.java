package com.propertyintel.price.exception;

import lombok.Getter;

/**
 * Raised when a numeric column has zero variance and cannot be z-scored.
 */
@Getter
public class DegenerateFeatureException extends PricePredictionException {

    private final String column;

    public DegenerateFeatureException(String column) {
        super("DEGENERATE_FEATURE", "Column '" + column + "' has zero variance and cannot be normalised");
        this.column = column;
    }
}
