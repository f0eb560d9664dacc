package com.propertyintel.price.exception;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A fetched dataset failed validation. Carries the first offending column,
 * the values that broke it and the constraint they were checked against.
 */
@Getter
public class SchemaViolationException extends PricePredictionException {

    private final String column;
    private final List<Object> violatingValues;
    private final String constraint;

    public SchemaViolationException(String column, List<Object> violatingValues, String constraint) {
        super("SCHEMA_ERROR", String.format("Column '%s' failed %s: %s", column, constraint, violatingValues));
        this.column = column;
        this.violatingValues = Collections.unmodifiableList(new ArrayList<>(violatingValues));
        this.constraint = constraint;
    }
}
