package com.propertyintel.price.regression;

import com.propertyintel.price.model.FeatureFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Least squares with a mixed L1/L2 penalty, fitted by cyclic coordinate descent.
 *
 * Minimises
 * <pre>
 *   (1 / 2n) * ||y - b0 - Xb||^2 + alpha * (l1Weight * |b|_1 + (1 - l1Weight) / 2 * ||b||^2)
 * </pre>
 * Iteration stops once no coefficient moves the fit by more than
 * {@code tolerance} times the target's scale (standard deviation with an
 * intercept, root mean square without).
 *
 * Without an intercept b0 is fixed at 0 and the raw columns are used. With one,
 * b0 is not penalised: columns and target are centred before the descent and
 * b0 is recovered from the means afterwards.
 */
@Slf4j
public class ElasticNetRegression {

    private final double alpha;
    private final double l1Weight;
    private final int maxIterations;
    private final double tolerance;
    private final boolean fitIntercept;

    public ElasticNetRegression(double alpha, double l1Weight, int maxIterations, double tolerance,
                                boolean fitIntercept) {
        if (alpha < 0) throw new IllegalArgumentException("alpha must be >= 0");
        if (l1Weight < 0 || l1Weight > 1) throw new IllegalArgumentException("l1Weight must be in [0, 1]");
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        this.alpha = alpha;
        this.l1Weight = l1Weight;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
        this.fitIntercept = fitIntercept;
    }

    /**
     * Fit {@code target} against every other column of the frame. All columns must be numeric.
     */
    public TrainedModel fit(FeatureFrame frame, String target) {
        List<String> features = frame.columns().stream()
                .filter(c -> !c.equals(target))
                .toList();
        return fit(frame.matrix(features), frame.numeric(target), features);
    }

    public TrainedModel fit(double[][] x, double[] y, List<String> features) {
        int n = y.length;
        int p = features.size();
        if (n == 0) throw new IllegalArgumentException("Cannot fit on zero rows");

        double yMean = fitIntercept ? mean(y) : 0;
        double[] xMeans = new double[p];
        if (fitIntercept) {
            for (int j = 0; j < p; j++) {
                double sum = 0;
                for (double[] row : x) sum += row[j];
                xMeans[j] = sum / n;
            }
        }

        // column-major copies for the descent, centred when fitting an intercept
        double[][] xc = new double[p][n];
        double[] columnScale = new double[p];
        for (int j = 0; j < p; j++) {
            double squares = 0;
            for (int i = 0; i < n; i++) {
                xc[j][i] = x[i][j] - xMeans[j];
                squares += xc[j][i] * xc[j][i];
            }
            columnScale[j] = squares / n;
        }

        double[] residual = new double[n];
        double targetSquares = 0;
        for (int i = 0; i < n; i++) {
            residual[i] = y[i] - yMean;
            targetSquares += residual[i] * residual[i];
        }
        // convergence is judged relative to the scale of the target
        double targetScale = targetSquares > 0 ? Math.sqrt(targetSquares / n) : 1.0;
        double threshold = tolerance * targetScale;

        double l1Penalty = alpha * l1Weight;
        double l2Penalty = alpha * (1 - l1Weight);
        double[] beta = new double[p];

        int iteration = 0;
        double maxChange = Double.POSITIVE_INFINITY;
        while (iteration < maxIterations && maxChange > threshold) {
            iteration++;
            maxChange = 0;
            for (int j = 0; j < p; j++) {
                double denominator = columnScale[j] + l2Penalty;
                if (columnScale[j] == 0 || denominator == 0) {
                    continue;
                }
                double rho = 0;
                for (int i = 0; i < n; i++) rho += xc[j][i] * residual[i];
                rho = rho / n + columnScale[j] * beta[j];

                double updated = softThreshold(rho, l1Penalty) / denominator;
                double delta = updated - beta[j];
                if (delta != 0) {
                    for (int i = 0; i < n; i++) residual[i] -= delta * xc[j][i];
                    beta[j] = updated;
                }
                maxChange = Math.max(maxChange, Math.abs(delta) * Math.sqrt(columnScale[j]));
            }
        }

        if (maxChange > threshold) {
            log.warn("Coordinate descent stopped after {} iterations without converging (last change {})",
                    iteration, maxChange);
        }

        double intercept = yMean;
        for (int j = 0; j < p; j++) intercept -= beta[j] * xMeans[j];

        log.debug("Elastic net fit on {} rows (intercept {}) took {} iterations", n, fitIntercept, iteration);
        return new TrainedModel(features, intercept, beta, iteration);
    }

    private static double softThreshold(double value, double threshold) {
        if (value > threshold) return value - threshold;
        if (value < -threshold) return value + threshold;
        return 0;
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }
}
