package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.TrainedModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ModelTrainingServiceTest {

    private final ModelTrainingService service = new ModelTrainingService(new TheoryEngineProperties());

    private static final double[][] X = {
            {1.0, 10.0},
            {2.0, Double.NaN},
            {3.0, 30.0},
            {4.0, 40.0},
            {5.0, Double.NaN},
            {6.0, 60.0}
    };
    private static final double[] Y = {0, 0, 0, 1, 1, 1};

    @Test
    @DisplayName("Standardisation : moyenne et écart-type de population sur les valeurs présentes")
    void standardizationIgnoresMissingValues() {
        TrainedModel model = service.fit(X, Y, List.of("a", "b"), MetricType.BINARY);

        assertThat(model.means()[0]).isCloseTo(3.5, within(1e-12));
        assertThat(model.stds()[0]).isCloseTo(Math.sqrt(17.5 / 6), within(1e-12));
        // b : 10, 30, 40, 60
        assertThat(model.means()[1]).isCloseTo(35.0, within(1e-12));
        assertThat(model.stds()[1]).isCloseTo(Math.sqrt(1300.0 / 4), within(1e-12));
        assertThat(model.weight(0)).isPositive();
    }

    @Test
    @DisplayName("Le modèle ajusté est immuable et deux ajustements identiques sont égaux")
    void trainedModelIsImmutableValue() {
        TrainedModel first = service.fit(X, Y, List.of("a", "b"), MetricType.BINARY);
        TrainedModel second = service.fit(X, Y, List.of("a", "b"), MetricType.BINARY);

        double original = first.weight(0);
        first.weights()[0] = 999.0;
        first.means()[0] = 999.0;

        assertThat(first.weight(0)).isEqualTo(original);
        assertThat(first.means()[0]).isCloseTo(3.5, within(1e-12));
        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
    }

    @Test
    @DisplayName("Ridge : la prédiction suit une cible linéaire")
    void ridgeFollowsLinearTarget() {
        double[][] x = {{1}, {2}, {3}, {4}, {5}, {6}, {7}, {8}};
        double[] y = {3, 5, 7, 9, 11, 13, 15, 17};

        TrainedModel model = service.fit(x, y, List.of("a"), MetricType.NUMERIC);

        assertThat(model.bias()).isCloseTo(10.0, within(1e-9));
        assertThat(model.predict(new double[]{4.5})).isCloseTo(10.0, within(1e-9));
        assertThat(model.predict(new double[]{8})).isGreaterThan(model.predict(new double[]{1}));
    }
}
