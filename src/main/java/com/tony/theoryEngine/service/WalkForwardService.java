package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.model.dto.BetTapeEntry;
import com.tony.theoryEngine.model.dto.SliceMetrics;
import com.tony.theoryEngine.model.dto.StageStatus;
import com.tony.theoryEngine.model.dto.WalkforwardResult;
import com.tony.theoryEngine.model.dto.WalkforwardSlice;
import com.tony.theoryEngine.model.dto.WalkforwardWindow;
import com.tony.theoryEngine.model.engine.CohortRow;
import com.tony.theoryEngine.model.engine.FeatureDefinition;
import com.tony.theoryEngine.model.engine.ReasonCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Validation glissante hors échantillon : le modèle est réajusté sur chaque fenêtre
 * d'entraînement puis appliqué tel quel à la fenêtre de test suivante.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalkForwardService {

    private final ModelBuilderService modelBuilder;
    private final TriggerService triggerService;
    private final ExposureControlService exposureService;
    private final TheoryEngineProperties properties;

    public StageStatus<WalkforwardResult> run(List<CohortRow> rows, List<FeatureDefinition> features, ResolvedTheory theory) {
        if (!theory.target().isMarket()) {
            return StageStatus.notRun(ReasonCode.STAT_TARGET_NOT_ELIGIBLE, "walk-forward requires a market target");
        }
        if (features.isEmpty()) {
            return StageStatus.notRun(ReasonCode.NO_FEATURES, "select at least one pre-game feature");
        }
        WalkforwardWindow window = theory.window() != null ? theory.window() : new WalkforwardWindow();
        int step = Math.max(window.getStepDays(), window.getTestDays());
        List<String> notes = new ArrayList<>();
        if (window.getStepDays() < window.getTestDays()) {
            notes.add("stepDays (" + window.getStepDays() + ") < testDays (" + window.getTestDays()
                    + "): advancing by " + step + " days so test windows never overlap");
        }

        List<CohortRow> ordered = rows.stream()
                .sorted(Comparator.comparing(CohortRow::getGameDate).thenComparing(CohortRow::getGameId))
                .toList();
        if (ordered.isEmpty()) {
            return StageStatus.unavailable(ReasonCode.NO_SLICES, "No rows to walk forward over");
        }
        LocalDate minDate = ordered.get(0).getGameDate();
        LocalDate maxDate = ordered.get(ordered.size() - 1).getGameDate();

        TheoryEngineProperties.Walkforward cfg = properties.getWalkforward();
        List<WalkforwardSlice> slices = new ArrayList<>();
        int skipped = 0;
        LocalDate cursor = minDate.plusDays(window.getTrainDays());
        while (!cursor.plusDays(window.getTestDays()).isAfter(maxDate)) {
            TheoryJobRunner.checkpoint("walkforward " + cursor);
            LocalDate trainStart = cursor.minusDays(window.getTrainDays());
            LocalDate testEnd = cursor.plusDays(window.getTestDays());
            List<CohortRow> train = between(ordered, trainStart, cursor);
            List<CohortRow> test = between(ordered, cursor, testEnd);

            WalkforwardSlice slice = null;
            if (train.size() >= cfg.getMinTrainRows() && test.size() >= cfg.getMinTestRows()) {
                slice = evaluateWindow(train, test, features, theory, trainStart, cursor, testEnd);
            }
            if (slice == null) {
                skipped++;
                log.debug("Fenêtre {} ignorée (train={}, test={})", cursor, train.size(), test.size());
            } else {
                slices.add(slice);
            }
            cursor = cursor.plusDays(step);
        }

        if (slices.isEmpty()) {
            return StageStatus.unavailable(ReasonCode.NO_SLICES,
                    "No window had at least " + cfg.getMinTrainRows() + " train rows and "
                            + cfg.getMinTestRows() + " test rows (" + skipped + " skipped)");
        }
        Integer halfLife = edgeHalfLife(slices);
        if (halfLife == null) {
            notes.add("Edge half-life undefined: initial edge missing or non-positive, or edge never halved");
        }
        log.info("📆 Walk-forward : {} fenêtres évaluées, {} ignorées, demi-vie={}", slices.size(), skipped, halfLife);
        return StageStatus.complete(WalkforwardResult.builder()
                .window(window)
                .effectiveStepDays(step)
                .edgeHalfLifeDays(halfLife)
                .slices(slices)
                .skippedWindows(skipped)
                .notes(notes)
                .build());
    }

    private WalkforwardSlice evaluateWindow(List<CohortRow> train, List<CohortRow> test, List<FeatureDefinition> features,
                                            ResolvedTheory theory, LocalDate trainStart, LocalDate start, LocalDate end) {
        ModelBuilderService.ModelBuildResult built = modelBuilder.build(train, features, theory.target());
        if (built.model() == null) {
            return null;
        }
        List<CohortRow> scored = triggerService.apply(modelBuilder.score(test, built.model()), theory.target(), theory.trigger());
        ExposureControlService.ExposureResult exposure = exposureService.simulate(scored, theory.target(), theory.exposure());
        List<BetTapeEntry> tape = exposure.tape();
        SliceMetrics metrics = PerformanceSliceService.metrics("window", tape);

        long withOdds = test.stream().filter(CohortRow::hasOdds).count();
        OptionalDouble edge = scored.stream().map(CohortRow::getEdge).filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue).average();
        return WalkforwardSlice.builder()
                .trainStart(trainStart)
                .startDate(start)
                .endDate(end.minusDays(1))
                .trainRows(train.size())
                .sampleSize(test.size())
                .betCount(tape.size())
                .hitRate(metrics.getHitRate())
                .roiUnits(metrics.getRoiPerBet())
                .edgeAvg(edge.isPresent() ? edge.getAsDouble() : null)
                .oddsCoveragePct(100.0 * withOdds / test.size())
                .build();
    }

    // [from, to)
    static List<CohortRow> between(List<CohortRow> ordered, LocalDate from, LocalDate to) {
        return ordered.stream()
                .filter(r -> !r.getGameDate().isBefore(from) && r.getGameDate().isBefore(to))
                .toList();
    }

    static Integer edgeHalfLife(List<WalkforwardSlice> slices) {
        Double initial = slices.get(0).getEdgeAvg();
        if (initial == null || initial <= 0) {
            return null;
        }
        for (int i = 1; i < slices.size(); i++) {
            Double edge = slices.get(i).getEdgeAvg();
            if (edge != null && edge <= initial / 2) {
                return (int) ChronoUnit.DAYS.between(slices.get(0).getStartDate(), slices.get(i).getStartDate());
            }
        }
        return null;
    }
}
