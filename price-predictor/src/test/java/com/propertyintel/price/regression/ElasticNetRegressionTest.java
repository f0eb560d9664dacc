package com.propertyintel.price.regression;

import com.propertyintel.price.model.FeatureFrame;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ElasticNetRegressionTest {

    @Test
    void fit_withoutPenalty_recoversExactLinearRelation() {
        // y = 3 + 2 * a - b
        double[] a = {1, 2, 3, 4, 5, 6, 7, 8};
        double[] b = {2, 1, 4, 3, 6, 5, 8, 9};
        double[] y = new double[a.length];
        for (int i = 0; i < a.length; i++) y[i] = 3 + 2 * a[i] - b[i];

        FeatureFrame frame = FeatureFrame.empty(a.length)
            .withNumeric("y", y)
            .withNumeric("a", a)
            .withNumeric("b", b);

        TrainedModel model = new ElasticNetRegression(0, 0.5, 10_000, 1e-12, true).fit(frame, "y");

        assertThat(model.features()).containsExactly("a", "b");
        assertThat(model.coefficient("a")).isCloseTo(2.0, within(1e-6));
        assertThat(model.coefficient("b")).isCloseTo(-1.0, within(1e-6));
        assertThat(model.intercept()).isCloseTo(3.0, within(1e-5));
        assertThat(model.meanAbsoluteError(frame, "y")).isCloseTo(0.0, within(1e-5));
    }

    @Test
    void fit_pureRidge_matchesClosedForm() {
        // single centred feature: beta = cov / (var + alpha) with var = 1.25, cov = 2.5
        double[][] x = {{1}, {2}, {3}, {4}};
        double[] y = {2, 4, 6, 8};

        TrainedModel model = new ElasticNetRegression(1.25, 0.0, 100, 1e-9, true).fit(x, y, List.of("x"));

        assertThat(model.coefficient("x")).isCloseTo(1.0, within(1e-12));
        assertThat(model.intercept()).isCloseTo(2.5, within(1e-12));
    }

    @Test
    void fit_ridgeThroughOrigin_matchesClosedForm() {
        // no intercept: beta = mean(x * y) / (mean(x^2) + alpha) = 15 / (7.5 + 7.5)
        double[][] x = {{1}, {2}, {3}, {4}};
        double[] y = {2, 4, 6, 8};

        TrainedModel model = new ElasticNetRegression(7.5, 0.0, 100, 1e-9, false).fit(x, y, List.of("x"));

        assertThat(model.coefficient("x")).isCloseTo(1.0, within(1e-12));
        assertThat(model.intercept()).isZero();
    }

    @Test
    void fit_withoutIntercept_absorbsOffsetIntoSlope() {
        // y = 10 + x has no exact fit through the origin; least squares gives sum(xy) / sum(x^2)
        double[][] x = {{1}, {2}, {3}};
        double[] y = {11, 12, 13};

        TrainedModel withoutIntercept = new ElasticNetRegression(0, 0.2, 100, 1e-12, false).fit(x, y, List.of("x"));
        TrainedModel withIntercept = new ElasticNetRegression(0, 0.2, 100, 1e-12, true).fit(x, y, List.of("x"));

        assertThat(withoutIntercept.intercept()).isZero();
        assertThat(withoutIntercept.coefficient("x")).isCloseTo(74.0 / 14.0, within(1e-9));
        assertThat(withIntercept.intercept()).isCloseTo(10.0, within(1e-9));
        assertThat(withIntercept.coefficient("x")).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void fit_strongLassoPenalty_zeroesEveryCoefficient() {
        double[][] x = {{1, 10}, {2, 30}, {3, 20}, {4, 40}};
        double[] y = {100, 210, 290, 405};

        TrainedModel model = new ElasticNetRegression(1e9, 1.0, 100, 1e-9, true).fit(x, y, List.of("p", "q"));

        assertThat(model.coefficients()).containsExactly(0.0, 0.0);
        assertThat(model.intercept()).isCloseTo(251.25, within(1e-9));
    }

    @Test
    void fit_constantFeature_getsZeroCoefficient() {
        double[][] x = {{1, 7}, {2, 7}, {3, 7}};
        double[] y = {10, 20, 30};

        TrainedModel model = new ElasticNetRegression(0.1, 0.2, 1000, 1e-9, true).fit(x, y, List.of("slope", "flat"));

        assertThat(model.coefficient("flat")).isZero();
        assertThat(model.coefficient("slope")).isPositive();
    }

    @Test
    void fit_rejectsUnencodedColumns() {
        FeatureFrame frame = FeatureFrame.empty(2)
            .withNumeric("price", new double[]{1, 2})
            .withCategorical("property_type", List.of("D", "T"));

        assertThatThrownBy(() -> new ElasticNetRegression(2, 0.2, 10, 1e-6, false).fit(frame, "price"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void constructor_rejectsL1WeightOutsideUnitInterval() {
        assertThatThrownBy(() -> new ElasticNetRegression(2, 1.5, 10, 1e-6, false))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
