package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.BetTapeEntry;
import com.tony.theoryEngine.model.dto.ExposureControls;
import com.tony.theoryEngine.model.dto.ExposureSummary;
import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.engine.CohortRow;
import com.tony.theoryEngine.model.engine.MarketType;
import com.tony.theoryEngine.util.OddsUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Plafonds d'exposition journaliers puis bande de mise à plat (1u) sur les paris retenus.
 */
@Slf4j
@Service
public class ExposureControlService {

    public static final String MISSING_LINE_FOR_SPREAD_BAND = "missing_line_for_spread_band";
    public static final String SPREAD_BAND_LOW = "spread_band_low";
    public static final String SPREAD_BAND_HIGH = "spread_band_high";

    private static final double STAKE = 1.0;

    public record ExposureResult(ExposureSummary summary, List<CohortRow> selected, List<BetTapeEntry> tape) {
    }

    // Meilleur edge d'abord, puis gameId croissant ; edge absent en dernier
    static final Comparator<CohortRow> SELECTION_ORDER = Comparator
            .comparing(CohortRow::getEdge, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(CohortRow::getGameId, Comparator.nullsLast(Comparator.naturalOrder()));

    static final Comparator<CohortRow> CHRONOLOGICAL = Comparator
            .comparing(CohortRow::getGameDate)
            .thenComparing(CohortRow::getGameId, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CohortRow::getSide, Comparator.nullsLast(Comparator.naturalOrder()));

    public ExposureResult simulate(List<CohortRow> rows, TargetDefinition target, ExposureControls controls) {
        ExposureControls caps = controls != null ? controls : ExposureControls.defaults();
        List<String> notes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        Map<String, Integer> rejections = new TreeMap<>();
        List<CohortRow> triggered = new ArrayList<>();
        for (CohortRow row : rows) {
            if (row.isTriggered()) {
                triggered.add(row);
            } else if (row.getTriggerReasons() != null) {
                row.getTriggerReasons().forEach(r -> rejections.merge(r, 1, Integer::sum));
            }
        }

        // Bande de spread (marché spread uniquement)
        boolean bandRequested = caps.getSpreadAbsMin() != null || caps.getSpreadAbsMax() != null;
        boolean bandApplies = bandRequested && target.isMarket() && target.getMarketType() == MarketType.SPREAD;
        if (bandRequested && !bandApplies) {
            notes.add("Spread band ignored: only applies to spread market targets");
        }
        List<CohortRow> eligible = new ArrayList<>();
        int droppedByBand = 0;
        for (CohortRow row : triggered) {
            String gate = bandApplies ? spreadGate(row, caps) : null;
            if (gate != null) {
                droppedByBand++;
                rejections.merge(gate, 1, Integer::sum);
            } else {
                eligible.add(row);
            }
        }
        if (droppedByBand > 0) {
            warnings.add(droppedByBand + " triggered bets removed by the spread band");
        }

        // Sélection jour par jour
        Map<LocalDate, List<CohortRow>> byDay = new TreeMap<>();
        eligible.forEach(r -> byDay.computeIfAbsent(r.getGameDate(), d -> new ArrayList<>()).add(r));
        List<CohortRow> selected = new ArrayList<>();
        int droppedByControls = 0;
        for (List<CohortRow> day : byDay.values()) {
            day.sort(SELECTION_ORDER);
            int dayCount = 0;
            Map<String, Integer> sideCount = new HashMap<>();
            for (CohortRow row : day) {
                int sideSoFar = sideCount.getOrDefault(row.getSide(), 0);
                boolean dayFull = caps.getMaxBetsPerDay() != null && dayCount >= caps.getMaxBetsPerDay();
                boolean sideFull = caps.getMaxBetsPerSidePerDay() != null && sideSoFar >= caps.getMaxBetsPerSidePerDay();
                if (dayFull || sideFull) {
                    droppedByControls++;
                    continue;
                }
                selected.add(row);
                dayCount++;
                sideCount.put(row.getSide(), sideSoFar + 1);
            }
        }
        if (droppedByControls > 0) {
            warnings.add(droppedByControls + " triggered bets throttled by daily exposure caps");
        }
        warnings.addAll(verifyCaps(selected, caps));

        selected.sort(CHRONOLOGICAL);
        List<BetTapeEntry> tape = buildTape(selected);

        Map<String, Integer> bySide = new TreeMap<>();
        selected.forEach(r -> bySide.merge(r.getSide(), 1, Integer::sum));
        long uniqueDays = selected.stream().map(CohortRow::getGameDate).distinct().count();
        double finalPnl = tape.isEmpty() ? 0.0 : tape.get(tape.size() - 1).getCumulativePnl();
        double maxDrawdown = tape.stream().mapToDouble(BetTapeEntry::getDrawdown).max().orElse(0.0);

        if (!target.isMarket()) {
            notes.add("Stat target: PnL priced at the " + (int) OddsUtils.FLAT_REFERENCE_PRICE + " reference, not a market price");
        }
        notes.add("Flat 1u stake per bet; PnL in units");

        ExposureSummary summary = ExposureSummary.builder()
                .candidateRows(rows.size())
                .triggered(triggered.size())
                .selected(selected.size())
                .droppedDueToControls(droppedByControls)
                .droppedBySpreadBand(droppedByBand)
                .uniqueDays((int) uniqueDays)
                .avgBetsPerDay(uniqueDays == 0 ? 0.0 : (double) selected.size() / uniqueDays)
                .bySide(bySide)
                .triggerRejections(rejections)
                .finalPnl(finalPnl)
                .maxDrawdown(maxDrawdown)
                .notes(notes)
                .warnings(warnings)
                .build();
        log.info("💼 Exposition : {} déclenchés, {} retenus sur {} jours, PnL final {}u",
                triggered.size(), selected.size(), uniqueDays, String.format("%.2f", finalPnl));
        return new ExposureResult(summary, selected, tape);
    }

    static String spreadGate(CohortRow row, ExposureControls caps) {
        if (row.getLine() == null) {
            return MISSING_LINE_FOR_SPREAD_BAND;
        }
        double abs = Math.abs(row.getLine());
        if (caps.getSpreadAbsMin() != null && abs < caps.getSpreadAbsMin()) {
            return SPREAD_BAND_LOW;
        }
        if (caps.getSpreadAbsMax() != null && abs > caps.getSpreadAbsMax()) {
            return SPREAD_BAND_HIGH;
        }
        return null;
    }

    /**
     * Vérification a posteriori : aucune journée ne dépasse ses plafonds.
     */
    static List<String> verifyCaps(List<CohortRow> selected, ExposureControls caps) {
        List<String> violations = new ArrayList<>();
        Map<LocalDate, Integer> perDay = new TreeMap<>();
        Map<String, Integer> perDaySide = new TreeMap<>();
        for (CohortRow row : selected) {
            perDay.merge(row.getGameDate(), 1, Integer::sum);
            perDaySide.merge(row.getGameDate() + "/" + row.getSide(), 1, Integer::sum);
        }
        if (caps.getMaxBetsPerDay() != null) {
            perDay.forEach((day, count) -> {
                if (count > caps.getMaxBetsPerDay()) {
                    violations.add("Cap violation: " + count + " bets on " + day);
                }
            });
        }
        if (caps.getMaxBetsPerSidePerDay() != null) {
            perDaySide.forEach((key, count) -> {
                if (count > caps.getMaxBetsPerSidePerDay()) {
                    violations.add("Cap violation: " + count + " bets for " + key);
                }
            });
        }
        if (!violations.isEmpty()) {
            log.warn("⚠️ Plafonds d'exposition dépassés : {}", violations);
        }
        return violations;
    }

    private List<BetTapeEntry> buildTape(List<CohortRow> chronological) {
        List<BetTapeEntry> tape = new ArrayList<>(chronological.size());
        double cumulative = 0.0;
        double peak = 0.0;
        int sequence = 0;
        for (CohortRow row : chronological) {
            double price = row.getPrice() != null ? row.getPrice() : OddsUtils.FLAT_REFERENCE_PRICE;
            double pnl = STAKE * OddsUtils.unitPnl(row.getOutcome(), price);
            cumulative += pnl;
            peak = Math.max(peak, cumulative);
            tape.add(BetTapeEntry.builder()
                    .sequence(++sequence)
                    .gameId(row.getGameId())
                    .gameDate(row.getGameDate())
                    .matchup(row.getAwayTeam() + " @ " + row.getHomeTeam())
                    .side(row.getSide())
                    .line(row.getLine())
                    .price(price)
                    .modelProb(row.getModelProb())
                    .impliedProb(row.getImpliedProb() != null ? row.getImpliedProb() : OddsUtils.impliedProbability(price))
                    .edge(row.getEdge())
                    .outcome(row.getOutcome())
                    .stake(STAKE)
                    .pnl(pnl)
                    .cumulativePnl(cumulative)
                    .drawdown(peak - cumulative)
                    .build());
        }
        return tape;
    }
}
