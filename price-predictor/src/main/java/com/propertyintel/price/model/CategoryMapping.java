package com.propertyintel.price.model;

import com.propertyintel.price.exception.UnknownCategoryException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Category-to-code table for one column, derived from the values observed in a
 * single training run. Codes follow lexicographic order of the distinct values,
 * so the same set of values always yields the same table.
 */
public final class CategoryMapping {

    private final String column;
    private final Map<String, Integer> codes;

    private CategoryMapping(String column, Map<String, Integer> codes) {
        this.column = column;
        this.codes = Collections.unmodifiableMap(codes);
    }

    public static CategoryMapping fromObserved(String column, Collection<String> observed) {
        Map<String, Integer> codes = new LinkedHashMap<>();
        int next = 0;
        for (String value : new TreeSet<>(observed)) {
            codes.put(value, next++);
        }
        return new CategoryMapping(column, codes);
    }

    /**
     * Codes assigned in the order given; used when the values already have a natural order.
     */
    public static CategoryMapping fromOrdered(String column, List<String> orderedDistinct) {
        Map<String, Integer> codes = new LinkedHashMap<>();
        for (String value : orderedDistinct) {
            codes.putIfAbsent(value, codes.size());
        }
        return new CategoryMapping(column, codes);
    }

    public String column() {
        return column;
    }

    public Map<String, Integer> codes() {
        return codes;
    }

    public int codeOf(String value) {
        Integer code = codes.get(value);
        if (code == null) {
            throw new UnknownCategoryException(column, value);
        }
        return code;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CategoryMapping other)) return false;
        return column.equals(other.column) && codes.equals(other.codes);
    }

    @Override
    public int hashCode() {
        return 31 * column.hashCode() + codes.hashCode();
    }

    @Override
    public String toString() {
        return column + codes;
    }
}
