package com.propertyintel.price.regression;

import com.propertyintel.price.model.FeatureFrame;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TrainedModelTest {

    private final TrainedModel model = new TrainedModel(List.of("a", "b"), 100, new double[]{2, -1}, 1);

    @Test
    void predict_readsFeaturesByNameNotPosition() {
        FeatureFrame frame = FeatureFrame.empty(1)
            .withNumeric("b", new double[]{10})
            .withNumeric("a", new double[]{5});

        assertThat(model.predict(frame)).containsExactly(100.0);
    }

    @Test
    void meanAbsoluteError_averagesAbsoluteResiduals() {
        FeatureFrame frame = FeatureFrame.empty(2)
            .withNumeric("price", new double[]{110, 90})
            .withNumeric("a", new double[]{0, 0})
            .withNumeric("b", new double[]{0, 0});

        assertThat(model.meanAbsoluteError(frame, "price")).isCloseTo(10.0, within(1e-12));
    }

    @Test
    void predict_wrongWidth_throws() {
        assertThatThrownBy(() -> model.predict(new double[]{1}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
