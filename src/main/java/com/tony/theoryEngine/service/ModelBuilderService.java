package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.exception.ModelFitException;
import com.tony.theoryEngine.model.dto.DroppedFeature;
import com.tony.theoryEngine.model.dto.FeatureWeight;
import com.tony.theoryEngine.model.dto.ModelSummary;
import com.tony.theoryEngine.model.dto.SignalDriver;
import com.tony.theoryEngine.model.dto.StageStatus;
import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.engine.CohortRow;
import com.tony.theoryEngine.model.engine.FeatureDefinition;
import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.ReasonCode;
import com.tony.theoryEngine.model.engine.TrainedModel;
import com.tony.theoryEngine.util.NumericValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Élagage, ajustement puis résumé du modèle. Un échec d'ajustement ne remonte jamais :
 * il devient un statut "unavailable" et les features concernées sont listées comme écartées.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelBuilderService {

    static final String ROI_PROXY_NOTE = "Exploratory sanity check: +1/-1 per row with p >= threshold, "
            + "not odds-calibrated, not a profitability claim";

    private final FeaturePruningService pruningService;
    private final ModelTrainingService trainingService;
    private final FeatureGeneratorService featureGenerator;
    private final TheoryEngineProperties properties;

    public record ModelBuildResult(StageStatus<ModelSummary> status, TrainedModel model, List<DroppedFeature> dropped) {
    }

    public ModelBuildResult build(List<CohortRow> rows, List<FeatureDefinition> features, TargetDefinition target) {
        List<DroppedFeature> dropped = new ArrayList<>();
        if (features.isEmpty()) {
            return new ModelBuildResult(StageStatus.notRun(ReasonCode.NO_FEATURES, "select at least one pre-game feature"), null, dropped);
        }

        List<CohortRow> trainable = rows.stream().filter(r -> r.getTargetValue() != null).toList();
        List<String> names = features.stream().map(FeatureDefinition::name).toList();
        int minRows = properties.getPruning().getMinValues();
        if (trainable.size() < minRows) {
            return new ModelBuildResult(StageStatus.unavailable(ReasonCode.INSUFFICIENT_SAMPLE,
                    "Only " + trainable.size() + " rows with a resolvable target (minimum " + minRows + ")"), null, dropped);
        }

        double[][] x = matrix(trainable, names);
        double[] y = trainable.stream().mapToDouble(CohortRow::getTargetValue).toArray();

        FeaturePruningService.PruningResult pruning = pruningService.prune(x, names);
        dropped.addAll(pruning.dropped());
        List<String> kept = pruning.keptColumns().stream().map(names::get).toList();
        if (kept.isEmpty()) {
            return new ModelBuildResult(StageStatus.unavailable(ReasonCode.NO_FEATURES,
                    "All " + names.size() + " features were pruned before fitting"), null, dropped);
        }

        try {
            TrainedModel model = trainingService.fit(columns(x, pruning.keptColumns()), y, kept, target.getMetricType());

            // Poids quasi nuls : on les retire puis on réajuste une fois
            List<String> zeroWeight = new ArrayList<>();
            for (int j = 0; j < kept.size(); j++) {
                if (Math.abs(model.weight(j)) <= properties.getPruning().getZeroWeightEpsilon()) {
                    zeroWeight.add(kept.get(j));
                    dropped.add(FeaturePruningService.drop(kept.get(j), FeaturePruningService.NEAR_ZERO_WEIGHT, null, model.weight(j)));
                }
            }
            if (!zeroWeight.isEmpty()) {
                List<String> remaining = kept.stream().filter(f -> !zeroWeight.contains(f)).toList();
                if (remaining.isEmpty()) {
                    return new ModelBuildResult(StageStatus.unavailable(ReasonCode.NO_FEATURES,
                            "Every fitted weight was ~0; no usable signal"), null, dropped);
                }
                model = trainingService.fit(matrix(trainable, remaining), y, remaining, target.getMetricType());
            }

            ModelSummary summary = summarize(model, trainable, features, y);
            log.info("🧠 Modèle {} : {} features, accuracy={}, roiProxy={}", summary.getModelType(),
                    summary.getFeaturesUsed().size(), summary.getAccuracy(), summary.getRoiProxy());
            return new ModelBuildResult(StageStatus.complete(summary), model, dropped);
        } catch (ModelFitException e) {
            log.warn("⚠️ Échec de l'ajustement du modèle : {}", e.getMessage());
            List<String> alreadyDropped = dropped.stream().map(DroppedFeature::getFeature).toList();
            kept.stream()
                    .filter(f -> !alreadyDropped.contains(f))
                    .forEach(f -> dropped.add(FeaturePruningService.drop(f, FeaturePruningService.MODEL_FIT_FAILED, null, null)));
            return new ModelBuildResult(StageStatus.unavailable(ReasonCode.MODEL_FIT_FAILED, e.getMessage()), null, dropped);
        }
    }

    /**
     * Probabilité (ou valeur prédite) du modèle pour chaque ligne.
     */
    public List<CohortRow> score(List<CohortRow> rows, TrainedModel model) {
        return rows.stream()
                .map(r -> r.toBuilder().modelProb(model.predict(r.getFeatures())).build())
                .toList();
    }

    private ModelSummary summarize(TrainedModel model, List<CohortRow> rows, List<FeatureDefinition> defs, double[] y) {
        Map<String, String> groups = new LinkedHashMap<>();
        defs.forEach(d -> groups.put(d.name(), featureGenerator.describe(d).getGroup()));

        List<FeatureWeight> weights = new ArrayList<>();
        for (int j = 0; j < model.featureNames().size(); j++) {
            String name = model.featureNames().get(j);
            weights.add(FeatureWeight.builder()
                    .feature(name)
                    .group(groups.getOrDefault(name, "other"))
                    .weight(model.weight(j))
                    .build());
        }
        weights.sort(Comparator.comparingDouble((FeatureWeight w) -> -Math.abs(w.getWeight())).thenComparing(FeatureWeight::getFeature));
        for (int i = 0; i < weights.size(); i++) {
            weights.get(i).setRank(i + 1);
        }

        double totalAbs = weights.stream().mapToDouble(w -> Math.abs(w.getWeight())).sum();
        Map<String, SignalDriver> drivers = new LinkedHashMap<>();
        for (FeatureWeight w : weights) {
            SignalDriver driver = drivers.computeIfAbsent(w.getGroup(), g -> SignalDriver.builder()
                    .group(g).features(new ArrayList<>()).build());
            driver.setAbsWeight(driver.getAbsWeight() + Math.abs(w.getWeight()));
            driver.getFeatures().add(w.getFeature());
        }
        List<SignalDriver> ranked = new ArrayList<>(drivers.values());
        ranked.forEach(d -> d.setShare(totalAbs > 0 ? d.getAbsWeight() / totalAbs : 0.0));
        ranked.sort(Comparator.comparingDouble((SignalDriver d) -> -d.getAbsWeight()).thenComparing(SignalDriver::getGroup));

        double[] predictions = rows.stream().mapToDouble(r -> model.predict(r.getFeatures())).toArray();
        ModelSummary.ModelSummaryBuilder summary = ModelSummary.builder()
                .modelType(model.metricType() == MetricType.BINARY ? "logistic_regression_l2" : "ridge_regression")
                .metricType(model.metricType())
                .trainingRows(rows.size())
                .featuresUsed(model.featureNames())
                .weights(weights)
                .bias(model.bias())
                .primarySignalDrivers(ranked)
                .accuracy(accuracy(model, predictions, y));

        if (model.metricType() == MetricType.BINARY) {
            double threshold = properties.getModel().getRoiProxyThreshold();
            int bets = 0;
            double units = 0;
            for (int i = 0; i < predictions.length; i++) {
                if (predictions[i] >= threshold) {
                    bets++;
                    units += y[i] >= 0.5 ? 1.0 : -1.0;
                }
            }
            summary.roiProxy(bets == 0 ? null : units / bets)
                    .roiProxyBets(bets)
                    .roiProxyNote(ROI_PROXY_NOTE);
        }
        return summary.build();
    }

    // Binaire : accord (p >= 0.5) / label. Numérique : même sens que la moyenne d'entraînement.
    static double accuracy(TrainedModel model, double[] predictions, double[] y) {
        int agree = 0;
        for (int i = 0; i < y.length; i++) {
            boolean ok;
            if (model.metricType() == MetricType.BINARY) {
                ok = (predictions[i] >= 0.5) == (y[i] >= 0.5);
            } else {
                double center = model.trainingTargetMean();
                ok = Math.signum(predictions[i] - center) == Math.signum(y[i] - center);
            }
            if (ok) {
                agree++;
            }
        }
        return y.length == 0 ? 0.0 : (double) agree / y.length;
    }

    static double[][] matrix(List<CohortRow> rows, List<String> names) {
        double[][] x = new double[rows.size()][names.size()];
        for (int i = 0; i < rows.size(); i++) {
            Map<String, Object> features = rows.get(i).getFeatures();
            for (int j = 0; j < names.size(); j++) {
                Double v = features == null ? null : NumericValues.toDouble(features.get(names.get(j)));
                x[i][j] = v == null ? Double.NaN : v;
            }
        }
        return x;
    }

    private static double[][] columns(double[][] x, List<Integer> keep) {
        double[][] out = new double[x.length][keep.size()];
        for (int i = 0; i < x.length; i++) {
            for (int k = 0; k < keep.size(); k++) {
                out[i][k] = x[i][keep.get(k)];
            }
        }
        return out;
    }
}
