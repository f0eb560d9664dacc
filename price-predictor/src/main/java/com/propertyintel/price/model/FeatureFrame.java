package com.propertyintel.price.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable column-oriented table of numeric and categorical columns.
 *
 * Every "with"/"select"/"rows" operation returns a new frame; neither the
 * receiver nor the arrays passed in are ever modified afterwards.
 */
public final class FeatureFrame {

    private final int rowCount;
    private final List<String> columns;
    private final Map<String, double[]> numeric;
    private final Map<String, List<String>> categorical;

    private FeatureFrame(int rowCount, List<String> columns,
                         Map<String, double[]> numeric, Map<String, List<String>> categorical) {
        this.rowCount = rowCount;
        this.columns = columns;
        this.numeric = numeric;
        this.categorical = categorical;
    }

    public static FeatureFrame empty(int rowCount) {
        if (rowCount < 0) throw new IllegalArgumentException("rowCount must be >= 0");
        return new FeatureFrame(rowCount, List.of(), Map.of(), Map.of());
    }

    public int rowCount() {
        return rowCount;
    }

    public List<String> columns() {
        return columns;
    }

    public boolean isNumeric(String name) {
        return numeric.containsKey(name);
    }

    public double[] numeric(String name) {
        double[] values = numeric.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No numeric column '" + name + "' in " + columns);
        }
        return values.clone();
    }

    public List<String> categorical(String name) {
        List<String> values = categorical.get(name);
        if (values == null) {
            throw new IllegalArgumentException("No categorical column '" + name + "' in " + columns);
        }
        return values;
    }

    /**
     * Adds or replaces a numeric column, keeping its position if it already existed.
     */
    public FeatureFrame withNumeric(String name, double[] values) {
        checkLength(name, values.length);
        Map<String, double[]> nextNumeric = new LinkedHashMap<>(numeric);
        Map<String, List<String>> nextCategorical = new LinkedHashMap<>(categorical);
        nextCategorical.remove(name);
        nextNumeric.put(name, values.clone());
        return new FeatureFrame(rowCount, appendColumn(name), freeze(nextNumeric), freeze(nextCategorical));
    }

    /**
     * Adds or replaces a categorical column, keeping its position if it already existed.
     */
    public FeatureFrame withCategorical(String name, List<String> values) {
        checkLength(name, values.size());
        Map<String, double[]> nextNumeric = new LinkedHashMap<>(numeric);
        Map<String, List<String>> nextCategorical = new LinkedHashMap<>(categorical);
        nextNumeric.remove(name);
        nextCategorical.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
        return new FeatureFrame(rowCount, appendColumn(name), freeze(nextNumeric), freeze(nextCategorical));
    }

    /**
     * Keeps only the named columns, in the order given.
     */
    public FeatureFrame select(List<String> names) {
        Map<String, double[]> nextNumeric = new LinkedHashMap<>();
        Map<String, List<String>> nextCategorical = new LinkedHashMap<>();
        for (String name : names) {
            if (numeric.containsKey(name)) {
                nextNumeric.put(name, numeric.get(name));
            } else if (categorical.containsKey(name)) {
                nextCategorical.put(name, categorical.get(name));
            } else {
                throw new IllegalArgumentException("No column '" + name + "' in " + columns);
            }
        }
        return new FeatureFrame(rowCount, List.copyOf(names), freeze(nextNumeric), freeze(nextCategorical));
    }

    public FeatureFrame drop(String name) {
        List<String> remaining = new ArrayList<>(columns);
        remaining.remove(name);
        return select(remaining);
    }

    /**
     * Subset of rows, in the order of {@code indices}.
     */
    public FeatureFrame rows(int[] indices) {
        Map<String, double[]> nextNumeric = new LinkedHashMap<>();
        numeric.forEach((name, values) -> {
            double[] picked = new double[indices.length];
            for (int i = 0; i < indices.length; i++) {
                picked[i] = values[indices[i]];
            }
            nextNumeric.put(name, picked);
        });
        Map<String, List<String>> nextCategorical = new LinkedHashMap<>();
        categorical.forEach((name, values) -> {
            List<String> picked = new ArrayList<>(indices.length);
            for (int index : indices) {
                picked.add(values.get(index));
            }
            nextCategorical.put(name, Collections.unmodifiableList(picked));
        });
        return new FeatureFrame(indices.length, columns, freeze(nextNumeric), freeze(nextCategorical));
    }

    /**
     * Row-major matrix of the named numeric columns.
     */
    public double[][] matrix(List<String> names) {
        double[][] matrix = new double[rowCount][names.size()];
        for (int j = 0; j < names.size(); j++) {
            String name = names.get(j);
            double[] values = numeric.get(name);
            if (values == null) {
                throw new IllegalStateException("Column '" + name + "' is not numeric; encode it first");
            }
            for (int i = 0; i < rowCount; i++) {
                matrix[i][j] = values[i];
            }
        }
        return matrix;
    }

    private void checkLength(String name, int length) {
        if (length != rowCount) {
            throw new IllegalArgumentException(String.format(
                    "Column '%s' has %d values but the frame has %d rows", name, length, rowCount));
        }
    }

    private List<String> appendColumn(String name) {
        if (columns.contains(name)) return columns;
        List<String> next = new ArrayList<>(columns);
        next.add(name);
        return List.copyOf(next);
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        return "FeatureFrame[rows=" + rowCount + ", columns=" + columns + "]";
    }
}
