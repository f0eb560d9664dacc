package com.propertyintel.price.regression;

import com.propertyintel.price.model.FeatureFrame;

import java.util.Arrays;
import java.util.List;

/**
 * Coefficients of one fit. Lives only as long as the request that produced it.
 */
public final class TrainedModel {

    private final List<String> features;
    private final double intercept;
    private final double[] coefficients;
    private final int iterations;

    TrainedModel(List<String> features, double intercept, double[] coefficients, int iterations) {
        this.features = List.copyOf(features);
        this.intercept = intercept;
        this.coefficients = coefficients.clone();
        this.iterations = iterations;
    }

    public List<String> features() {
        return features;
    }

    public double intercept() {
        return intercept;
    }

    public double[] coefficients() {
        return coefficients.clone();
    }

    public double coefficient(String feature) {
        int index = features.indexOf(feature);
        if (index < 0) throw new IllegalArgumentException("Unknown feature '" + feature + "'");
        return coefficients[index];
    }

    public int iterations() {
        return iterations;
    }

    public double predict(double[] row) {
        if (row.length != coefficients.length) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d features %s, got %d", coefficients.length, features, row.length));
        }
        double y = intercept;
        for (int j = 0; j < row.length; j++) {
            y += coefficients[j] * row[j];
        }
        return y;
    }

    /**
     * Predict every row of a frame, reading the features by name.
     */
    public double[] predict(FeatureFrame frame) {
        double[][] x = frame.matrix(features);
        double[] predictions = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            predictions[i] = predict(x[i]);
        }
        return predictions;
    }

    /**
     * Mean absolute error of the model against {@code target} on {@code frame}.
     */
    public double meanAbsoluteError(FeatureFrame frame, String target) {
        if (frame.rowCount() == 0) {
            throw new IllegalArgumentException("Cannot evaluate on an empty frame");
        }
        double[] actual = frame.numeric(target);
        double[] predicted = predict(frame);
        double absErrorSum = 0;
        for (int i = 0; i < actual.length; i++) {
            absErrorSum += Math.abs(actual[i] - predicted[i]);
        }
        return absErrorSum / actual.length;
    }

    @Override
    public String toString() {
        return "TrainedModel[intercept=" + intercept + ", " + features + "=" + Arrays.toString(coefficients) + "]";
    }
}
