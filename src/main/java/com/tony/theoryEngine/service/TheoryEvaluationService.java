package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.model.dto.CorrelationResult;
import com.tony.theoryEngine.model.dto.StabilityBucket;
import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.dto.TheoryEvaluation;
import com.tony.theoryEngine.model.engine.BetOutcome;
import com.tony.theoryEngine.model.engine.CohortRow;
import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.ReasonCode;
import com.tony.theoryEngine.util.NumericValues;
import com.tony.theoryEngine.util.OddsUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Compare la cohorte à la population de référence.
 * Les bandes de verdict et de taille d'échantillon sont des libellés indicatifs, pas des tests statistiques.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TheoryEvaluationService {

    static final String ADVISORY_NOTE = "Verdict and sample-size bands are advisory labels (tunable policy), not statistical tests";

    private final TheoryEngineProperties properties;

    public TheoryEvaluation evaluate(List<CohortRow> baseline, List<CohortRow> cohort, TargetDefinition target) {
        TheoryEvaluation evaluation = target.isMarket()
                ? evaluateMarket(baseline, cohort, target)
                : evaluateStat(baseline, cohort, target);
        log.info("📊 Évaluation {} : n={}, baseline={}, cohorte={}, verdict={}", target.getTargetName(),
                evaluation.getSampleSize(), evaluation.getBaselineValue(), evaluation.getCohortValue(), evaluation.getVerdict());
        return evaluation;
    }

    private TheoryEvaluation evaluateStat(List<CohortRow> baseline, List<CohortRow> cohort, TargetDefinition target) {
        double[] cohortValues = targetValues(cohort);
        double[] baselineValues = targetValues(baseline);
        List<String> notes = new ArrayList<>();
        notes.add(ADVISORY_NOTE);

        TheoryEvaluation.TheoryEvaluationBuilder eval = TheoryEvaluation.builder()
                .targetClass(target.getTargetClass())
                .targetName(target.getTargetName())
                .metricType(target.getMetricType())
                .sampleSize(cohortValues.length)
                .baselineSampleSize(baselineValues.length)
                .notes(notes);

        if (cohortValues.length == 0) {
            notes.add("insufficient_sample: no cohort rows with a resolvable target value");
            return eval.reasonCode(ReasonCode.INSUFFICIENT_SAMPLE)
                    .sampleBand(sampleBand(0))
                    .verdict("insufficient data")
                    .build();
        }

        DescriptiveStatistics cohortStats = new DescriptiveStatistics(cohortValues);
        double baselineValue = new DescriptiveStatistics(baselineValues).getMean();
        double cohortValue = cohortStats.getMean();
        double delta = cohortValue - baselineValue;

        eval.baselineValue(baselineValue)
                .cohortValue(cohortValue)
                .delta(delta)
                .stabilityBySeason(stability(cohort, r -> String.valueOf(r.getSeason()), this::mean))
                .stabilityByMonth(stability(cohort, r -> r.getGameDate().toString().substring(0, 7), this::mean))
                .sampleBand(sampleBand(cohortValues.length));

        if (target.getMetricType() == MetricType.NUMERIC) {
            eval.cohortStd(cohortStats.getStandardDeviation())
                    .cohortMin(cohortStats.getMin())
                    .cohortMax(cohortStats.getMax())
                    .cohortP25(cohortStats.getPercentile(25))
                    .cohortP75(cohortStats.getPercentile(75));
            // Les bandes sont exprimées en proportion : pour une cible numérique on juge l'écart relatif
            Double relative = baselineValue != 0 ? delta / Math.abs(baselineValue) : null;
            eval.verdict(relative == null ? "insufficient data" : verdict(relative));
            notes.add("Numeric target: mean comparison only, no rate semantics; verdict uses relative lift delta/|baseline|");
        } else {
            eval.wins(count(cohort, BetOutcome.WIN))
                    .losses(count(cohort, BetOutcome.LOSS))
                    .pushes(count(cohort, BetOutcome.PUSH))
                    .verdict(verdict(delta));
        }
        return eval.build();
    }

    private TheoryEvaluation evaluateMarket(List<CohortRow> baseline, List<CohortRow> cohort, TargetDefinition target) {
        List<String> notes = new ArrayList<>();
        notes.add(ADVISORY_NOTE);
        boolean oddsRequired = target.isOddsRequired();
        Predicate<CohortRow> admissible = r -> !oddsRequired || r.hasOdds();

        List<CohortRow> cohortSettled = cohort.stream().filter(admissible).filter(CohortRow::isSettled).toList();
        List<CohortRow> baselineSettled = baseline.stream().filter(admissible).filter(CohortRow::isSettled).toList();
        long withOdds = cohort.stream().filter(CohortRow::hasOdds).count();

        TheoryEvaluation.TheoryEvaluationBuilder eval = TheoryEvaluation.builder()
                .targetClass(target.getTargetClass())
                .targetName(target.getTargetName())
                .metricType(target.getMetricType())
                .oddsAssumption(target.getOddsAssumption())
                .sampleSize(cohortSettled.size())
                .baselineSampleSize(baselineSettled.size())
                .pushes((int) cohort.stream().filter(admissible).filter(r -> r.getOutcome() == BetOutcome.PUSH).count())
                .oddsCoveragePct(cohort.isEmpty() ? null : 100.0 * withOdds / cohort.size())
                .sampleBand(sampleBand(cohortSettled.size()))
                .notes(notes);

        if (cohort.isEmpty()) {
            notes.add("insufficient_sample: the cohort is empty");
            return eval.reasonCode(ReasonCode.INSUFFICIENT_SAMPLE).verdict("insufficient data").build();
        }
        if (oddsRequired && withOdds == 0) {
            notes.add("no_odds_coverage: none of the " + cohort.size() + " cohort games has closing odds for this market");
            return eval.reasonCode(ReasonCode.NO_ODDS_COVERAGE).verdict("insufficient data").build();
        }
        if (cohortSettled.isEmpty()) {
            notes.add("insufficient_sample: no settled (win/loss) rows in the cohort");
            return eval.reasonCode(ReasonCode.INSUFFICIENT_SAMPLE).verdict("insufficient data").build();
        }

        int wins = count(cohortSettled, BetOutcome.WIN);
        int losses = count(cohortSettled, BetOutcome.LOSS);
        double cohortValue = (double) wins / (wins + losses);
        double baselineValue = (double) count(baselineSettled, BetOutcome.WIN) / baselineSettled.size();
        double delta = cohortValue - baselineValue;

        eval.wins(wins)
                .losses(losses)
                .baselineValue(baselineValue)
                .cohortValue(cohortValue)
                .delta(delta)
                .verdict(verdict(delta))
                .stabilityBySeason(stability(cohortSettled, r -> String.valueOf(r.getSeason()), this::hitRate))
                .stabilityByMonth(stability(cohortSettled, r -> r.getGameDate().toString().substring(0, 7), this::hitRate));

        List<CohortRow> priced = cohort.stream().filter(CohortRow::hasOdds)
                .filter(r -> r.getOutcome() != null).toList();
        if (!priced.isEmpty()) {
            double implied = priced.stream().filter(CohortRow::isSettled)
                    .filter(r -> r.getImpliedProb() != null)
                    .mapToDouble(CohortRow::getImpliedProb).average().orElse(Double.NaN);
            double roi = priced.stream().mapToDouble(r -> OddsUtils.unitPnl(r.getOutcome(), r.getPrice())).average().orElse(0.0);
            if (!Double.isNaN(implied)) {
                eval.impliedRate(implied).evVsImplied(cohortValue - implied);
            }
            eval.roiUnits(roi);
            notes.add("ROI in units uses " + target.getOddsAssumption().getCode() + " pricing, 1u flat stake");
        } else {
            notes.add("No closing odds in the cohort: implied rate and ROI not computed");
        }
        return eval.build();
    }

    public List<CorrelationResult> correlations(List<CohortRow> rows, List<String> featureNames) {
        TheoryEngineProperties.Evaluation cfg = properties.getEvaluation();
        List<CorrelationResult> results = new ArrayList<>();
        PearsonsCorrelation pearson = new PearsonsCorrelation();
        for (String feature : featureNames) {
            List<double[]> pairs = new ArrayList<>();
            for (CohortRow row : rows) {
                Double x = NumericValues.toDouble(row.getFeatures().get(feature));
                if (x != null && row.getTargetValue() != null) {
                    pairs.add(new double[]{x, row.getTargetValue()});
                }
            }
            if (pairs.size() < cfg.getMinCorrelationSample()) {
                continue;
            }
            double[] xs = pairs.stream().mapToDouble(p -> p[0]).toArray();
            double[] ys = pairs.stream().mapToDouble(p -> p[1]).toArray();
            double r = pearson.correlation(xs, ys);
            // NaN = variance nulle d'un côté
            if (Double.isNaN(r)) {
                continue;
            }
            results.add(CorrelationResult.builder()
                    .feature(feature)
                    .correlation(r)
                    .sampleSize(pairs.size())
                    .significant(Math.abs(r) > cfg.getSignificantCorrelation() && pairs.size() >= cfg.getSignificantCorrelationSample())
                    .build());
        }
        results.sort(Comparator.comparingDouble((CorrelationResult c) -> -Math.abs(c.getCorrelation()))
                .thenComparing(CorrelationResult::getFeature));
        return results;
    }

    public List<String> insights(TheoryEvaluation evaluation, List<CorrelationResult> correlations) {
        List<String> insights = new ArrayList<>();
        int n = evaluation.getSampleSize();
        insights.add("Sample size: " + n + " games (" + evaluation.getSampleBand() + ")");
        if (n < properties.getEvaluation().getSmallSampleWarning()) {
            insights.add("Warning: small sample (n < " + properties.getEvaluation().getSmallSampleWarning()
                    + "); treat any lift as anecdotal");
        }
        if (evaluation.getDelta() != null) {
            insights.add(String.format(Locale.ROOT, "Cohort %.4f vs baseline %.4f (delta %+.4f): %s",
                    evaluation.getCohortValue(), evaluation.getBaselineValue(), evaluation.getDelta(), evaluation.getVerdict()));
        } else if (evaluation.getReasonCode() != null) {
            insights.add("Evaluation not available: " + evaluation.getReasonCode().getCode());
        }
        if (evaluation.getEvVsImplied() != null) {
            insights.add(String.format(Locale.ROOT, "Hit rate %.4f vs implied %.4f (edge %+.4f), ROI %+.4f u/bet",
                    evaluation.getCohortValue(), evaluation.getImpliedRate(), evaluation.getEvVsImplied(), evaluation.getRoiUnits()));
        }
        correlations.stream().limit(3).forEach(c -> insights.add(String.format(Locale.ROOT,
                "Correlation %s: r=%+.3f (n=%d)%s", c.getFeature(), c.getCorrelation(), c.getSampleSize(),
                c.isSignificant() ? "" : ", not significant")));
        return insights;
    }

    String verdict(double delta) {
        TheoryEngineProperties.Evaluation cfg = properties.getEvaluation();
        if (delta > cfg.getStrongLift()) {
            return "strong lift";
        }
        if (delta >= cfg.getModerateLift()) {
            return "moderate lift";
        }
        return delta > 0 ? "small lift" : "negative/no lift";
    }

    String sampleBand(int n) {
        TheoryEngineProperties.Evaluation cfg = properties.getEvaluation();
        if (n >= cfg.getLargeSample()) {
            return "large";
        }
        return n >= cfg.getModerateSample() ? "moderate" : "small";
    }

    private List<StabilityBucket> stability(List<CohortRow> rows, Function<CohortRow, String> key,
                                            Function<List<CohortRow>, Double> metric) {
        Map<String, List<CohortRow>> groups = new TreeMap<>();
        for (CohortRow row : rows) {
            if (row.getTargetValue() != null) {
                groups.computeIfAbsent(key.apply(row), k -> new ArrayList<>()).add(row);
            }
        }
        List<StabilityBucket> buckets = new ArrayList<>();
        groups.forEach((label, group) -> buckets.add(new StabilityBucket(label, group.size(), metric.apply(group))));
        return buckets;
    }

    private Double mean(List<CohortRow> rows) {
        return rows.stream().mapToDouble(CohortRow::getTargetValue).average().orElse(Double.NaN);
    }

    private Double hitRate(List<CohortRow> rows) {
        return (double) count(rows, BetOutcome.WIN) / rows.size();
    }

    private static double[] targetValues(List<CohortRow> rows) {
        return rows.stream().filter(r -> r.getTargetValue() != null).mapToDouble(CohortRow::getTargetValue).toArray();
    }

    private static int count(List<CohortRow> rows, BetOutcome outcome) {
        return (int) rows.stream().filter(r -> r.getOutcome() == outcome).count();
    }
}
