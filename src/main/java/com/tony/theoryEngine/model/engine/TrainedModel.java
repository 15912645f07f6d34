package com.tony.theoryEngine.model.engine;

import com.tony.theoryEngine.util.NumericValues;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Modèle linéaire sur features standardisées. Une valeur manquante est imputée à la moyenne d'entraînement.
 */
public record TrainedModel(
        MetricType metricType,
        List<String> featureNames,
        double[] means,
        double[] stds,
        double[] weights,
        double bias,
        double trainingTargetMean
) {
    private static final double LOGIT_CLAMP = 50.0;

    // Le modèle est immuable : copies à l'entrée comme à la sortie
    public TrainedModel {
        featureNames = List.copyOf(featureNames);
        means = means.clone();
        stds = stds.clone();
        weights = weights.clone();
    }

    @Override
    public double[] means() {
        return means.clone();
    }

    @Override
    public double[] stds() {
        return stds.clone();
    }

    @Override
    public double[] weights() {
        return weights.clone();
    }

    public double weight(int j) {
        return weights[j];
    }

    public double[] vectorize(Map<String, Object> features) {
        double[] x = new double[featureNames.size()];
        for (int j = 0; j < x.length; j++) {
            Double v = features == null ? null : NumericValues.toDouble(features.get(featureNames.get(j)));
            x[j] = v == null ? Double.NaN : v;
        }
        return x;
    }

    public double linearScore(double[] raw) {
        double z = bias;
        for (int j = 0; j < weights.length; j++) {
            z += weights[j] * standardize(raw[j], j);
        }
        return z;
    }

    /**
     * Probabilité pour une cible binaire, valeur prédite pour une cible numérique.
     */
    public double predict(double[] raw) {
        double z = linearScore(raw);
        return metricType == MetricType.BINARY ? sigmoid(z) : z;
    }

    public double predict(Map<String, Object> features) {
        return predict(vectorize(features));
    }

    public double standardize(double value, int j) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return stds[j] > 0 ? (value - means[j]) / stds[j] : 0.0;
    }

    public static double sigmoid(double z) {
        double clamped = Math.max(-LOGIT_CLAMP, Math.min(LOGIT_CLAMP, z));
        return 1.0 / (1.0 + Math.exp(-clamped));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TrainedModel)) {
            return false;
        }
        TrainedModel other = (TrainedModel) o;
        return metricType == other.metricType
                && featureNames.equals(other.featureNames)
                && Arrays.equals(means, other.means)
                && Arrays.equals(stds, other.stds)
                && Arrays.equals(weights, other.weights)
                && Double.compare(bias, other.bias) == 0
                && Double.compare(trainingTargetMean, other.trainingTargetMean) == 0;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(metricType, featureNames, bias, trainingTargetMean);
        result = 31 * result + Arrays.hashCode(means);
        result = 31 * result + Arrays.hashCode(stds);
        result = 31 * result + Arrays.hashCode(weights);
        return result;
    }

    @Override
    public String toString() {
        return "TrainedModel[" + metricType + ", features=" + featureNames + ", weights=" + Arrays.toString(weights)
                + ", bias=" + bias + "]";
    }
}
