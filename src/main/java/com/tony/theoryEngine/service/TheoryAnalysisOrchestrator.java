package com.tony.theoryEngine.service;

import com.tony.theoryEngine.config.TheoryEngineProperties;
import com.tony.theoryEngine.model.dto.AnalysisRequest;
import com.tony.theoryEngine.model.dto.AnalysisResponse;
import com.tony.theoryEngine.model.dto.BetSimulation;
import com.tony.theoryEngine.model.dto.CorrelationResult;
import com.tony.theoryEngine.model.dto.FeatureGenerationRequest;
import com.tony.theoryEngine.model.dto.FeatureGenerationResponse;
import com.tony.theoryEngine.model.dto.ModelBuildRequest;
import com.tony.theoryEngine.model.dto.ModelBuildResponse;
import com.tony.theoryEngine.model.dto.ModelSnapshot;
import com.tony.theoryEngine.model.dto.MonteCarloResult;
import com.tony.theoryEngine.model.dto.StageStatus;
import com.tony.theoryEngine.model.dto.TheoryEvaluation;
import com.tony.theoryEngine.model.dto.WalkforwardRequest;
import com.tony.theoryEngine.model.dto.WalkforwardResponse;
import com.tony.theoryEngine.model.dto.WalkforwardResult;
import com.tony.theoryEngine.model.dto.WalkforwardWindow;
import com.tony.theoryEngine.model.engine.CohortRow;
import com.tony.theoryEngine.model.engine.FeatureDefinition;
import com.tony.theoryEngine.model.engine.GameSnapshot;
import com.tony.theoryEngine.model.engine.MetricType;
import com.tony.theoryEngine.model.engine.ReasonCode;
import com.tony.theoryEngine.model.engine.RunType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Point d'entrée des opérations : validation, chargement, cohorte, features, cible,
 * nettoyage, puis étapes propres à chaque opération. Le snapshot n'est écrit
 * qu'une fois tout le pipeline terminé.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TheoryAnalysisOrchestrator {

    private final TheoryRequestValidator validator;
    private final FeatureGeneratorService featureGenerator;
    private final FeaturePolicyService featurePolicy;
    private final HistoricalGameStore gameStore;
    private final CohortBuilderService cohortBuilder;
    private final FeatureComputationService featureComputation;
    private final TargetResolverService targetResolver;
    private final DatasetPreparationService datasetPreparation;
    private final TheoryEvaluationService evaluationService;
    private final ModelBuilderService modelBuilder;
    private final TriggerService triggerService;
    private final ExposureControlService exposureService;
    private final PerformanceSliceService sliceService;
    private final MonteCarloService monteCarloService;
    private final WalkForwardService walkForwardService;
    private final RunSnapshotService runStore;
    private final TheoryJobRunner jobRunner;
    private final TheoryEngineProperties properties;

    /**
     * Données préparées communes aux trois opérations.
     */
    record PreparedTheory(ResolvedTheory theory,
                          FeaturePolicyService.PolicyOutcome policy,
                          List<CohortRow> baseline,
                          List<CohortRow> cohort,
                          DatasetPreparationService.CleaningResult cleaning,
                          List<String> notes) {
    }

    public FeatureGenerationResponse generateFeatures(FeatureGenerationRequest request) {
        return featureGenerator.generate(request);
    }

    public AnalysisResponse analyze(AnalysisRequest request) {
        return jobRunner.run("analyze", () -> {
            ResolvedTheory theory = validator.resolve(request.getFilters(), request.getFeatures(), request.getTarget(),
                    null, null, request.getCleaning(), request.getContext(), null);
            FeaturePolicyService.PolicyOutcome policy = featurePolicy.apply(theory.features(), theory.context(),
                    theory.target(), theory.league());
            Map<String, Object> payload = payload(RunType.ANALYZE, theory, policy);
            String hash = runStore.hash(payload);
            String runId = RunSnapshotService.runId(RunType.ANALYZE, hash);

            PreparedTheory prepared = prepare(theory, policy);
            List<String> featureNames = names(policy.kept());
            TheoryEvaluation evaluation = evaluationService.evaluate(prepared.baseline(), prepared.cohort(), theory.target());
            TheoryJobRunner.checkpoint("correlations");
            List<CorrelationResult> correlations = evaluationService.correlations(prepared.cohort(), featureNames);

            AnalysisResponse response = AnalysisResponse.builder()
                    .runId(runId)
                    .snapshotHash(hash)
                    .sampleSize(evaluation.getSampleSize())
                    .baselineValue(evaluation.getBaselineValue())
                    .cohortValue(evaluation.getCohortValue())
                    .delta(evaluation.getDelta())
                    .correlations(correlations)
                    .insights(evaluationService.insights(evaluation, correlations))
                    .cleaningSummary(prepared.cleaning().summary())
                    .featurePolicy(policy.report())
                    .evaluation(evaluation)
                    .modeling(StageStatus.notRun(ReasonCode.NOT_REQUESTED, "use build_model to fit a model"))
                    .notes(prepared.notes())
                    .build();
            runStore.commit(runId, hash, RunType.ANALYZE, theory.league().code(), theory.target().getTargetName(),
                    evaluation.getSampleSize(), payload, response);
            return response;
        });
    }

    public ModelBuildResponse buildModel(ModelBuildRequest request) {
        return jobRunner.run("build_model", () -> {
            ResolvedTheory theory = validator.resolve(request.getFilters(), request.getFeatures(), request.getTarget(),
                    request.getTrigger(), request.getExposure(), request.getCleaning(), request.getContext(), null);
            FeaturePolicyService.PolicyOutcome policy = featurePolicy.apply(theory.features(), theory.context(),
                    theory.target(), theory.league());
            Map<String, Object> payload = payload(RunType.MODEL, theory, policy);
            String hash = runStore.hash(payload);
            String runId = RunSnapshotService.runId(RunType.MODEL, hash);

            PreparedTheory prepared = prepare(theory, policy);
            List<String> notes = new ArrayList<>(prepared.notes());
            TheoryEvaluation evaluation = evaluationService.evaluate(prepared.baseline(), prepared.cohort(), theory.target());

            List<CohortRow> trainable = prepared.cohort();
            if (theory.target().isMarket() && theory.target().isOddsRequired()) {
                trainable = trainable.stream().filter(CohortRow::hasOdds).toList();
            }

            TheoryJobRunner.checkpoint("model");
            ModelBuilderService.ModelBuildResult built;
            if (theory.target().isMarket() && theory.target().isOddsRequired() && trainable.isEmpty() && !prepared.cohort().isEmpty()) {
                built = new ModelBuilderService.ModelBuildResult(
                        StageStatus.unavailable(ReasonCode.NO_ODDS_COVERAGE, "No cohort row has closing odds for this market"),
                        null, List.of());
            } else {
                built = modelBuilder.build(trainable, policy.kept(), theory.target());
            }

            StageStatus<BetSimulation> simulation;
            StageStatus<MonteCarloResult> monteCarlo;
            if (theory.target().isStat() && theory.target().getMetricType() == MetricType.NUMERIC) {
                simulation = StageStatus.notRun(ReasonCode.NUMERIC_TARGET_NO_PROBABILITY,
                        "numeric stat targets have no win probability to trigger on");
                monteCarlo = StageStatus.notRun(ReasonCode.STAT_TARGET_NOT_ELIGIBLE, "numeric stat targets produce no bet sequence");
            } else if (built.model() == null) {
                ReasonCode reason = reasonOf(built.status());
                simulation = StageStatus.notRun(reason, "requires a fitted model");
                monteCarlo = StageStatus.notRun(reason, "requires a fitted model");
            } else {
                TheoryJobRunner.checkpoint("simulation");
                List<CohortRow> scored = triggerService.apply(modelBuilder.score(trainable, built.model()),
                        theory.target(), theory.trigger());
                ExposureControlService.ExposureResult exposure = exposureService.simulate(scored, theory.target(), theory.exposure());
                simulation = StageStatus.complete(BetSimulation.builder()
                        .exposureSummary(exposure.summary())
                        .betTape(exposure.tape())
                        .performanceSlices(sliceService.slices(exposure.tape(), theory.target()))
                        .failureAnalysis(sliceService.failures(exposure.tape()))
                        .build());
                TheoryJobRunner.checkpoint("monte_carlo");
                monteCarlo = monteCarloService.run(exposure.tape(), theory.target());
                notes.add("Simulation is in-sample (model scored on its training rows); use walk-forward for out-of-sample results");
            }

            ModelBuildResponse response = ModelBuildResponse.builder()
                    .runId(runId)
                    .modelSnapshot(ModelSnapshot.builder().runId(runId).hash(hash).runType(RunType.MODEL.getCode()).build())
                    .evaluation(evaluation)
                    .cleaningSummary(prepared.cleaning().summary())
                    .featurePolicy(policy.report())
                    .modeling(built.status())
                    .featuresDropped(built.dropped())
                    .simulation(simulation)
                    .monteCarlo(monteCarlo)
                    .notes(notes)
                    .build();
            runStore.commit(runId, hash, RunType.MODEL, theory.league().code(), theory.target().getTargetName(),
                    evaluation.getSampleSize(), payload, response);
            return response;
        });
    }

    public WalkforwardResponse runWalkforward(WalkforwardRequest request) {
        return jobRunner.run("walkforward", () -> {
            WalkforwardWindow window = request.getWindow() != null ? request.getWindow() : new WalkforwardWindow();
            ResolvedTheory theory = validator.resolve(request.getFilters(), request.getFeatures(), request.getTarget(),
                    request.getTrigger(), request.getExposure(), request.getCleaning(), request.getContext(), window);
            FeaturePolicyService.PolicyOutcome policy = featurePolicy.apply(theory.features(), theory.context(),
                    theory.target(), theory.league());
            Map<String, Object> payload = payload(RunType.WALKFORWARD, theory, policy);
            String hash = runStore.hash(payload);
            String runId = RunSnapshotService.runId(RunType.WALKFORWARD, hash);

            StageStatus<WalkforwardResult> result;
            int sampleSize = 0;
            if (!theory.target().isMarket()) {
                // Pas d'accès aux données pour une cible non éligible
                result = StageStatus.notRun(ReasonCode.STAT_TARGET_NOT_ELIGIBLE, "walk-forward requires a market target");
            } else {
                PreparedTheory prepared = prepare(theory, policy);
                List<CohortRow> rows = prepared.cohort();
                if (theory.target().isOddsRequired()) {
                    rows = rows.stream().filter(CohortRow::hasOdds).toList();
                }
                sampleSize = rows.size();
                if (rows.isEmpty() && !prepared.cohort().isEmpty()) {
                    result = StageStatus.unavailable(ReasonCode.NO_ODDS_COVERAGE, "No cohort row has closing odds for this market");
                } else {
                    result = walkForwardService.run(rows, policy.kept(), theory);
                }
            }

            WalkforwardResponse response = WalkforwardResponse.builder()
                    .runId(runId)
                    .snapshotHash(hash)
                    .result(result)
                    .build();
            runStore.commit(runId, hash, RunType.WALKFORWARD, theory.league().code(), theory.target().getTargetName(),
                    sampleSize, payload, response);
            return response;
        });
    }

    PreparedTheory prepare(ResolvedTheory theory, FeaturePolicyService.PolicyOutcome policy) {
        String league = theory.league().code();
        List<GameSnapshot> history = gameStore.loadCompletedGames(league, theory.filters().getSeasons());
        TheoryJobRunner.checkpoint("cohort");

        CohortBuilderService.CohortSelection selection = cohortBuilder.select(history, theory.filters(), theory.target());
        TheoryJobRunner.checkpoint("features");
        Map<Long, Map<String, Object>> features = featureComputation.compute(history, selection.baseline(), policy.kept());

        TheoryJobRunner.checkpoint("target");
        List<CohortRow> baselineRows = targetResolver.buildRows(selection.baseline(), features, theory.target());
        Set<Long> cohortIds = selection.cohortIds();
        List<CohortRow> cohortRows = baselineRows.stream().filter(r -> cohortIds.contains(r.getGameId())).toList();

        // Règles ligne par ligne : la cohorte nettoyée reste incluse dans la population nettoyée
        List<String> names = names(policy.kept());
        DatasetPreparationService.CleaningResult baselineClean = datasetPreparation.clean(baselineRows, names, theory.cleaning());
        DatasetPreparationService.CleaningResult cohortClean = datasetPreparation.clean(cohortRows, names, theory.cleaning());

        List<String> notes = new ArrayList<>(selection.notes());
        if (history.isEmpty()) {
            notes.add("No completed games found for " + league);
        }
        log.info("🏀 [{}] population={} cohorte={} (après nettoyage {}/{})", league, baselineRows.size(), cohortRows.size(),
                baselineClean.kept().size(), cohortClean.kept().size());
        return new PreparedTheory(theory, policy, baselineClean.kept(), cohortClean.kept(), cohortClean, notes);
    }

    /**
     * Tout ce qui détermine le résultat, paramètres du moteur compris. Jamais l'horodatage.
     */
    Map<String, Object> payload(RunType type, ResolvedTheory theory, FeaturePolicyService.PolicyOutcome policy) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", type.getCode());
        payload.put("leagueCode", theory.league().code());
        payload.put("filters", theory.filters());
        payload.put("features", names(theory.features()));
        payload.put("modelFeatures", names(policy.kept()));
        payload.put("target", theory.target());
        payload.put("cleaning", theory.cleaning());
        payload.put("context", theory.context());
        if (type != RunType.ANALYZE) {
            payload.put("trigger", theory.trigger());
            payload.put("exposure", theory.exposure());
        }
        if (theory.window() != null) {
            payload.put("window", theory.window());
        }
        payload.put("engine", engineSettings());
        return payload;
    }

    private Map<String, Object> engineSettings() {
        Map<String, Object> engine = new LinkedHashMap<>();
        engine.put("evaluation", properties.getEvaluation());
        engine.put("pruning", properties.getPruning());
        engine.put("model", properties.getModel());
        engine.put("monteCarlo", properties.getMonteCarlo());
        engine.put("walkforward", properties.getWalkforward());
        return engine;
    }

    static ReasonCode reasonOf(StageStatus<?> status) {
        if (status instanceof StageStatus.Unavailable) {
            return ((StageStatus.Unavailable<?>) status).reasonCode();
        }
        if (status instanceof StageStatus.NotRun) {
            return ((StageStatus.NotRun<?>) status).reasonCode();
        }
        return ReasonCode.NOT_REQUESTED;
    }

    private static List<String> names(List<FeatureDefinition> defs) {
        return defs.stream().map(FeatureDefinition::name).toList();
    }
}
