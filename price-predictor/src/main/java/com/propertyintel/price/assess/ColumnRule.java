package com.propertyintel.price.assess;

import com.propertyintel.price.model.PriceRecord;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Constraint on one column of a price-record dataset.
 *
 * @param column     column name reported on failure
 * @param extractor  reads the column's value from a record
 * @param type       expected Java type of non-null values
 * @param nullable   whether null is allowed
 * @param unique     whether values must be distinct across the dataset
 * @param check      value check applied to non-null values
 * @param constraint human-readable description of {@code check}
 */
public record ColumnRule(
        String column,
        Function<PriceRecord, Object> extractor,
        Class<?> type,
        boolean nullable,
        boolean unique,
        Predicate<Object> check,
        String constraint
) {

    public static ColumnRule required(String column, Class<?> type, Function<PriceRecord, Object> extractor) {
        return new ColumnRule(column, extractor, type, false, false, v -> true, "present");
    }

    public static ColumnRule optional(String column, Class<?> type, Function<PriceRecord, Object> extractor) {
        return new ColumnRule(column, extractor, type, true, false, v -> true, "any value");
    }

    public ColumnRule withCheck(Predicate<Object> nextCheck, String description) {
        return new ColumnRule(column, extractor, type, nullable, unique, nextCheck, description);
    }

    public ColumnRule asUnique() {
        return new ColumnRule(column, extractor, type, nullable, true, check, constraint);
    }
}
