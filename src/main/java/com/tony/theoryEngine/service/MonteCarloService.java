package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.model.dto.BetTapeEntry;
import com.tony.theoryEngine.model.dto.DistributionSummary;
import com.tony.theoryEngine.model.dto.MonteCarloResult;
import com.tony.theoryEngine.model.dto.StageStatus;
import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.engine.BetOutcome;
import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.ReasonCode;
import com.tony.theoryEngine.util.OddsUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;

/**
 * Bootstrap de la séquence de PnL réalisée. Chaque essai a son propre générateur,
 * le résultat ne dépend donc pas de l'ordonnancement des threads.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonteCarloService {

    static final String LUCK_SCORE_METHOD = "percentile_rank: share of bootstrap final PnLs strictly below "
            + "the actual final PnL, ties counted half";

    private final TheoryEngineProperties properties;

    public StageStatus<MonteCarloResult> run(List<BetTapeEntry> tape, TargetDefinition target) {
        if (target.isStat() && target.getMetricType() == MetricType.NUMERIC) {
            return StageStatus.notRun(ReasonCode.STAT_TARGET_NOT_ELIGIBLE, "numeric stat targets produce no bet sequence");
        }
        TheoryEngineProperties.MonteCarlo cfg = properties.getMonteCarlo();
        if (tape.size() < cfg.getMinBets()) {
            return StageStatus.unavailable(ReasonCode.TOO_FEW_BETS,
                    tape.size() + " realized bets, at least " + cfg.getMinBets() + " required");
        }
        return StageStatus.complete(simulate(tape, cfg.getRuns(), cfg.getSeed()));
    }

    MonteCarloResult simulate(List<BetTapeEntry> tape, int runs, long seed) {
        double[] pnl = tape.stream().mapToDouble(BetTapeEntry::getPnl).toArray();
        double actualFinal = 0;
        for (double v : pnl) {
            actualFinal += v;
        }
        double actualDrawdown = maxDrawdown(pnl);

        double[] finals = new double[runs];
        double[] drawdowns = new double[runs];
        IntStream.range(0, runs).parallel().forEach(trial -> {
            Random rng = trialRandom(seed, trial);
            double[] path = new double[pnl.length];
            for (int i = 0; i < pnl.length; i++) {
                path[i] = pnl[rng.nextInt(pnl.length)];
            }
            double total = 0;
            for (double v : path) {
                total += v;
            }
            finals[trial] = total;
            drawdowns[trial] = maxDrawdown(path);
        });

        double impliedNull = impliedNullMean(tape, runs, seed);
        DistributionSummary finalSummary = summarize(finals);
        DistributionSummary drawdownSummary = summarize(drawdowns);
        double luck = percentileRank(finals, actualFinal);

        Map<String, Object> assumptions = new LinkedHashMap<>();
        assumptions.put("stake", "1u flat");
        assumptions.put("resampling", "with replacement");
        assumptions.put("independence", "bets exchangeable and independent");
        assumptions.put("betCount", pnl.length);

        log.info("🎲 Monte Carlo : {} essais sur {} paris, p50={}u, luck={}", runs, pnl.length,
                String.format("%.2f", finalSummary.getP50()), String.format("%.3f", luck));

        return MonteCarloResult.builder()
                .runs(runs)
                .seed(seed)
                .betCount(pnl.length)
                .actualFinalPnl(actualFinal)
                .actualMaxDrawdown(actualDrawdown)
                .finalPnl(finalSummary)
                .maxDrawdown(drawdownSummary)
                .luckScore(luck)
                .luckScoreMethod(LUCK_SCORE_METHOD)
                .drawdownPercentileRank(percentileRank(drawdowns, actualDrawdown))
                .impliedNullMeanPnl(impliedNull)
                .excessVsImplied(actualFinal - impliedNull)
                .assumptions(assumptions)
                .interpretation(interpret(finalSummary, actualFinal, impliedNull))
                .caveats(List.of(
                        "Bootstrap ignores streaks and regime changes between seasons",
                        "Closing prices assumed available at bet time",
                        "Distribution describes variance of this bet set, not future performance"))
                .build();
    }

    /**
     * PnL moyen d'un parieur « juste au prix du marché » : chaque pari gagne avec sa probabilité implicite.
     */
    static double impliedNullMean(List<BetTapeEntry> tape, int runs, long seed) {
        double[] totals = new double[runs];
        IntStream.range(0, runs).parallel().forEach(trial -> {
            Random rng = trialRandom(~seed, trial);
            double total = 0;
            for (BetTapeEntry bet : tape) {
                if (bet.getOutcome() == BetOutcome.PUSH) {
                    continue;
                }
                double price = bet.getPrice() != null ? bet.getPrice() : OddsUtils.FLAT_REFERENCE_PRICE;
                Double implied = OddsUtils.impliedProbability(price);
                boolean win = rng.nextDouble() < (implied == null ? 0.5 : implied);
                total += bet.getStake() * OddsUtils.unitPnl(win ? BetOutcome.WIN : BetOutcome.LOSS, price);
            }
            totals[trial] = total;
        });
        double sum = 0;
        for (double t : totals) {
            sum += t;
        }
        return runs == 0 ? 0.0 : sum / runs;
    }

    static Random trialRandom(long seed, int trial) {
        return new Random(seed * 1_000_003L + trial);
    }

    static double maxDrawdown(double[] pnl) {
        double cumulative = 0;
        double peak = 0;
        double worst = 0;
        for (double v : pnl) {
            cumulative += v;
            peak = Math.max(peak, cumulative);
            worst = Math.max(worst, peak - cumulative);
        }
        return worst;
    }

    static double percentileRank(double[] distribution, double value) {
        if (distribution.length == 0) {
            return 0.0;
        }
        double below = 0;
        double ties = 0;
        for (double v : distribution) {
            if (v < value) {
                below++;
            } else if (v == value) {
                ties++;
            }
        }
        return (below + 0.5 * ties) / distribution.length;
    }

    static DistributionSummary summarize(double[] values) {
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        return DistributionSummary.builder()
                .p5(stats.getPercentile(5))
                .p50(stats.getPercentile(50))
                .p95(stats.getPercentile(95))
                .mean(stats.getMean())
                .std(stats.getStandardDeviation())
                .build();
    }

    private static List<String> interpret(DistributionSummary finals, double actual, double impliedNull) {
        List<String> lines = new ArrayList<>();
        if (finals.getP5() > 0) {
            lines.add("Even the 5th percentile resampled path finishes positive");
        } else if (finals.getP50() > 0) {
            lines.add("Median resampled path is positive but the 5th percentile loses "
                    + String.format(Locale.ROOT, "%.2f", -finals.getP5()) + "u");
        } else {
            lines.add("Median resampled path is not profitable");
        }
        if (actual - impliedNull > 0) {
            lines.add("Actual PnL beats a market-fair bettor by " + String.format(Locale.ROOT, "%.2f", actual - impliedNull) + "u");
        } else {
            lines.add("Actual PnL does not beat a market-fair bettor on the same bets");
        }
        return lines;
    }
}
