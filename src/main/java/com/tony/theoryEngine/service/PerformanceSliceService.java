package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.BetTapeEntry;
import com.tony.theoryEngine.model.dto.FailureAnalysis;
import com.tony.theoryEngine.model.dto.PerformanceSlices;
import com.tony.theoryEngine.model.dto.SliceMetrics;
import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.engine.BetOutcome;
import com.tony.theoryEngine.model.engine.MarketType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Predicate;

/**
 * Découpage de la bande de paris (confiance, spread, favori/outsider) et analyse des pertes.
 */
@Slf4j
@Service
public class PerformanceSliceService {

    static final int TOP_LOSSES = 10;

    public PerformanceSlices slices(List<BetTapeEntry> tape, TargetDefinition target) {
        List<String> notes = new ArrayList<>();

        List<SliceMetrics> byConfidence = List.of(
                metrics("p>=0.60", filter(tape, e -> prob(e) >= 0.60)),
                metrics("0.55-0.60", filter(tape, e -> prob(e) >= 0.55 && prob(e) < 0.60)),
                metrics("0.50-0.55", filter(tape, e -> prob(e) >= 0.50 && prob(e) < 0.55)));

        MarketType market = target.isMarket() ? target.getMarketType() : null;
        List<SliceMetrics> bySpread = new ArrayList<>();
        if (market == MarketType.SPREAD) {
            bySpread.add(metrics("|line|<3", filter(tape, e -> absLine(e) < 3)));
            bySpread.add(metrics("3-6", filter(tape, e -> absLine(e) >= 3 && absLine(e) < 6)));
            bySpread.add(metrics("6-10", filter(tape, e -> absLine(e) >= 6 && absLine(e) < 10)));
            bySpread.add(metrics("|line|>=10", filter(tape, e -> absLine(e) >= 10 && absLine(e) != Double.MAX_VALUE)));
        } else {
            notes.add("Spread buckets only apply to spread market targets");
        }

        List<SliceMetrics> byFavorite = new ArrayList<>();
        if (market == MarketType.SPREAD || market == MarketType.MONEYLINE) {
            byFavorite.add(metrics("favorite", filter(tape, e -> Boolean.TRUE.equals(isFavorite(e, market)))));
            byFavorite.add(metrics("underdog", filter(tape, e -> Boolean.FALSE.equals(isFavorite(e, market)))));
        } else {
            notes.add("Favorite/underdog split only applies to spread and moneyline targets");
        }

        SliceMetrics overall = metrics("overall", tape);
        if (overall.isRedZone() && overall.getN() > 0) {
            notes.add("Overall slice is in the red zone (negative ROI or hit rate below implied)");
        }
        return PerformanceSlices.builder()
                .overall(overall)
                .byConfidence(byConfidence)
                .bySpreadBucket(bySpread)
                .byFavoriteUnderdog(byFavorite)
                .notes(notes)
                .build();
    }

    public FailureAnalysis failures(List<BetTapeEntry> tape) {
        List<BetTapeEntry> losses = tape.stream().filter(e -> e.getOutcome() == BetOutcome.LOSS).toList();

        List<BetTapeEntry> largest = losses.stream()
                .sorted(Comparator.comparingDouble(BetTapeEntry::getPnl).thenComparingInt(BetTapeEntry::getSequence))
                .limit(TOP_LOSSES)
                .toList();
        List<BetTapeEntry> overconfident = losses.stream()
                .filter(e -> e.getModelProb() != null)
                .sorted(Comparator.comparing(BetTapeEntry::getModelProb, Comparator.reverseOrder())
                        .thenComparingInt(BetTapeEntry::getSequence))
                .limit(TOP_LOSSES)
                .toList();

        List<SliceMetrics> edgeBuckets = List.of(
                metrics("edge<0", filter(tape, e -> e.getEdge() != null && e.getEdge() < 0)),
                metrics("0-1%", filter(tape, e -> e.getEdge() != null && e.getEdge() >= 0 && e.getEdge() < 0.01)),
                metrics("1-2%", filter(tape, e -> e.getEdge() != null && e.getEdge() >= 0.01 && e.getEdge() < 0.02)),
                metrics("2-4%", filter(tape, e -> e.getEdge() != null && e.getEdge() >= 0.02 && e.getEdge() < 0.04)),
                metrics(">=4%", filter(tape, e -> e.getEdge() != null && e.getEdge() >= 0.04)));

        List<String> notes = new ArrayList<>();
        if (losses.isEmpty()) {
            notes.add("No losing bets in the tape");
        } else {
            notes.add(losses.size() + " losing bets out of " + tape.size());
        }
        SliceMetrics top = edgeBuckets.get(edgeBuckets.size() - 1);
        if (top.getN() > 0 && top.isRedZone()) {
            notes.add("Highest-edge bucket is in the red zone: the model edge is not realized");
        }
        log.debug("Analyse des pertes : {} pertes, {} surconfiantes listées", losses.size(), overconfident.size());
        return FailureAnalysis.builder()
                .largestLosses(largest)
                .overconfidentLosses(overconfident)
                .edgeBuckets(edgeBuckets)
                .notes(notes)
                .build();
    }

    static SliceMetrics metrics(String label, List<BetTapeEntry> entries) {
        int wins = 0;
        int losses = 0;
        int pushes = 0;
        double pnl = 0;
        for (BetTapeEntry e : entries) {
            pnl += e.getPnl();
            if (e.getOutcome() == BetOutcome.WIN) {
                wins++;
            } else if (e.getOutcome() == BetOutcome.LOSS) {
                losses++;
            } else if (e.getOutcome() == BetOutcome.PUSH) {
                pushes++;
            }
        }
        int n = entries.size();
        Double hitRate = wins + losses == 0 ? null : (double) wins / (wins + losses);
        Double roi = n == 0 ? null : pnl / n;
        Double avgImplied = average(entries.stream().map(BetTapeEntry::getImpliedProb).toList());
        Double hitMinusImplied = hitRate == null || avgImplied == null ? null : hitRate - avgImplied;
        boolean redZone = (roi != null && roi < 0) || (hitMinusImplied != null && hitMinusImplied < 0);

        return SliceMetrics.builder()
                .label(label)
                .n(n)
                .wins(wins)
                .losses(losses)
                .pushes(pushes)
                .hitRate(hitRate)
                .pnlUnits(pnl)
                .roiPerBet(roi)
                .avgModelProb(average(entries.stream().map(BetTapeEntry::getModelProb).toList()))
                .avgImpliedProb(avgImplied)
                .avgEdge(average(entries.stream().map(BetTapeEntry::getEdge).toList()))
                .hitMinusImplied(hitMinusImplied)
                .redZone(redZone)
                .build();
    }

    // Spread : domicile avec ligne < 0 ou extérieur avec ligne > 0. Moneyline : cote négative.
    static Boolean isFavorite(BetTapeEntry entry, MarketType market) {
        if (market == MarketType.MONEYLINE) {
            return entry.getPrice() == null ? null : entry.getPrice() < 0;
        }
        if (entry.getLine() == null || entry.getLine() == 0.0) {
            return null;
        }
        return "home".equals(entry.getSide()) ? entry.getLine() < 0 : entry.getLine() > 0;
    }

    private static List<BetTapeEntry> filter(List<BetTapeEntry> tape, Predicate<BetTapeEntry> predicate) {
        return tape.stream().filter(predicate).toList();
    }

    private static double prob(BetTapeEntry e) {
        return e.getModelProb() == null ? -1.0 : e.getModelProb();
    }

    private static double absLine(BetTapeEntry e) {
        return e.getLine() == null ? Double.MAX_VALUE : Math.abs(e.getLine());
    }

    private static Double average(List<Double> values) {
        OptionalDouble avg = values.stream().filter(Objects::nonNull).mapToDouble(Double::doubleValue).average();
        return avg.isPresent() ? avg.getAsDouble() : null;
    }
}
