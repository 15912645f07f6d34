package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.FeaturePolicyReport;
import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.engine.AnalysisContext;
import com.tony.theoryEngine.model.engine.FeatureDefinition;
import com.tony.theoryEngine.model.engine.FeatureTiming;
import com.tony.theoryEngine.service.LeagueCatalogService.LeagueProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Politique anti-fuite : en contexte deployable, aucune feature post-match n'entre dans le modèle.
 * Les alias directs de la cible sont retirés dans tous les contextes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeaturePolicyService {

    private final FeatureGeneratorService featureGenerator;

    public record PolicyOutcome(List<FeatureDefinition> kept, FeaturePolicyReport report) {
    }

    public PolicyOutcome apply(List<FeatureDefinition> features, AnalysisContext context,
                               TargetDefinition target, LeagueProfile league) {
        Set<String> aliases = targetAliases(target, league);
        List<FeatureDefinition> kept = new ArrayList<>();
        List<String> droppedPostGame = new ArrayList<>();
        List<String> droppedLeakage = new ArrayList<>();
        boolean postGameKept = false;

        for (FeatureDefinition def : features) {
            if (aliases.contains(def.name())) {
                droppedLeakage.add(def.name());
                continue;
            }
            boolean postGame = featureGenerator.describe(def).getTiming() == FeatureTiming.POST_GAME;
            if (postGame && context == AnalysisContext.DEPLOYABLE) {
                droppedPostGame.add(def.name());
                continue;
            }
            postGameKept |= postGame;
            kept.add(def);
        }

        List<String> notes = new ArrayList<>();
        if (!droppedPostGame.isEmpty()) {
            notes.add(droppedPostGame.size() + " post-game feature(s) excluded from the deployable context");
        }
        if (!droppedLeakage.isEmpty()) {
            notes.add("Removed direct aliases of target '" + target.getTargetName() + "': " + String.join(", ", droppedLeakage));
        }
        if (postGameKept) {
            notes.add("Diagnostic context: post-game features are included; results are not valid for forward-looking triggers");
        }
        if (!droppedPostGame.isEmpty() || !droppedLeakage.isEmpty()) {
            log.debug("Politique features [{}] : post-game exclues={}, alias cible={}", context.getCode(), droppedPostGame, droppedLeakage);
        }

        FeaturePolicyReport report = FeaturePolicyReport.builder()
                .context(context)
                .keptFeatures(kept.stream().map(FeatureDefinition::name).toList())
                .droppedPostGameFeatures(droppedPostGame)
                .droppedTargetLeakageFeatures(droppedLeakage)
                .containsPostGameFeatures(postGameKept)
                .notes(notes)
                .build();
        return new PolicyOutcome(kept, report);
    }

    static Set<String> targetAliases(TargetDefinition target, LeagueProfile league) {
        if (!target.isStat()) {
            return Set.of();
        }
        String score = league.scoreStat();
        return switch (target.getTargetName()) {
            case TargetDefinitions.COMBINED_SCORE -> Set.of("total_" + score);
            case TargetDefinitions.MARGIN_OF_VICTORY, TargetDefinitions.HOME_WIN, TargetDefinitions.AWAY_WIN -> Set.of(score + "_diff");
            case TargetDefinitions.HOME_POINTS -> Set.of("home_" + score);
            case TargetDefinitions.AWAY_POINTS -> Set.of("away_" + score);
            default -> Set.of();
        };
    }
}
