package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.FeatureGenerationRequest;
import com.tony.theoryEngine.model.dto.FeatureGenerationResponse;
import com.tony.theoryEngine.model.dto.GeneratedFeature;
import com.tony.theoryEngine.model.engine.FeatureCategory;
import com.tony.theoryEngine.model.engine.FeatureDefinition;
import com.tony.theoryEngine.model.engine.FeatureKind;
import com.tony.theoryEngine.model.engine.FeatureTiming;
import com.tony.theoryEngine.service.LeagueCatalogService.LeagueProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureGeneratorService {

    public static final int DEFAULT_ROLLING_WINDOW = 5;
    public static final int MIN_ROLLING_WINDOW = 2;
    public static final int MAX_ROLLING_WINDOW = 20;

    private static final Pattern ROLLING = Pattern.compile("^rolling_(.+)_(\\d+)_(home|away|diff)$");

    private static final Set<String> EFFICIENCY_TOKENS = Set.of("fg", "fg3", "efg", "ts", "ft", "pct", "avg");
    private static final Set<String> DISCIPLINE_TOKENS = Set.of("assists", "turnovers", "fouls", "penalties", "penalty", "errors");
    private static final Set<String> PACE_TOKENS = Set.of("pace", "possessions", "possession");
    private static final Set<String> SCORING_TOKENS = Set.of("points", "runs", "goals", "score");

    private final LeagueCatalogService leagueCatalog;

    public FeatureGenerationResponse generate(FeatureGenerationRequest request) {
        LeagueProfile league = leagueCatalog.require(request.getLeagueCode());
        int window = clampWindow(request.getRollingWindow());

        // Dédoublonnage en gardant l'ordre de la demande
        Set<String> requested = new LinkedHashSet<>();
        if (request.getRawStats() != null) {
            request.getRawStats().stream()
                    .filter(s -> s != null && !s.isBlank())
                    .map(s -> s.trim().toLowerCase())
                    .forEach(requested::add);
        }

        List<String> known = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (String stat : requested) {
            if (league.hasStat(stat)) {
                known.add(stat);
            } else {
                skipped.add(stat);
            }
        }

        List<GeneratedFeature> features = new ArrayList<>();
        for (String stat : known) {
            features.add(describe(new FeatureDefinition("home_" + stat, FeatureKind.RAW_HOME, stat, 0)));
            features.add(describe(new FeatureDefinition("away_" + stat, FeatureKind.RAW_AWAY, stat, 0)));
            features.add(describe(new FeatureDefinition(stat + "_diff", FeatureKind.DIFF, stat, 0)));
            features.add(describe(new FeatureDefinition("total_" + stat, FeatureKind.TOTAL, stat, 0)));
        }
        if (request.isIncludeRestDays()) {
            features.add(describe(new FeatureDefinition("home_rest_days", FeatureKind.REST_HOME, null, 0)));
            features.add(describe(new FeatureDefinition("away_rest_days", FeatureKind.REST_AWAY, null, 0)));
            features.add(describe(new FeatureDefinition("rest_advantage", FeatureKind.REST_ADVANTAGE, null, 0)));
        }
        if (request.isIncludeRolling()) {
            for (String stat : known) {
                String prefix = "rolling_" + stat + "_" + window;
                features.add(describe(new FeatureDefinition(prefix + "_home", FeatureKind.ROLLING_HOME, stat, window)));
                features.add(describe(new FeatureDefinition(prefix + "_away", FeatureKind.ROLLING_AWAY, stat, window)));
                features.add(describe(new FeatureDefinition(prefix + "_diff", FeatureKind.ROLLING_DIFF, stat, window)));
            }
        }

        String summary = summarize(features.size(), known.size(), request.isIncludeRestDays(),
                request.isIncludeRolling(), window, skipped);
        log.info("🧮 [{}] {}", league.code(), summary);

        return FeatureGenerationResponse.builder()
                .leagueCode(league.code())
                .features(features)
                .skippedStats(skipped)
                .rollingWindow(window)
                .summary(summary)
                .build();
    }

    public static int clampWindow(Integer window) {
        if (window == null) {
            return DEFAULT_ROLLING_WINDOW;
        }
        return Math.max(MIN_ROLLING_WINDOW, Math.min(MAX_ROLLING_WINDOW, window));
    }

    /**
     * Retrouve la définition d'une feature à partir de son nom, pour la ligue donnée.
     */
    public Optional<FeatureDefinition> parse(String name, LeagueProfile league) {
        if (name == null) {
            return Optional.empty();
        }
        switch (name) {
            case "home_rest_days":
                return Optional.of(new FeatureDefinition(name, FeatureKind.REST_HOME, null, 0));
            case "away_rest_days":
                return Optional.of(new FeatureDefinition(name, FeatureKind.REST_AWAY, null, 0));
            case "rest_advantage":
                return Optional.of(new FeatureDefinition(name, FeatureKind.REST_ADVANTAGE, null, 0));
            default:
                break;
        }

        Matcher rolling = ROLLING.matcher(name);
        if (rolling.matches() && league.hasStat(rolling.group(1))) {
            int window = Integer.parseInt(rolling.group(2));
            if (window < MIN_ROLLING_WINDOW || window > MAX_ROLLING_WINDOW) {
                return Optional.empty();
            }
            FeatureKind kind = switch (rolling.group(3)) {
                case "home" -> FeatureKind.ROLLING_HOME;
                case "away" -> FeatureKind.ROLLING_AWAY;
                default -> FeatureKind.ROLLING_DIFF;
            };
            return Optional.of(new FeatureDefinition(name, kind, rolling.group(1), window));
        }

        // L'ordre compte : "total_yards_diff" est un différentiel de total_yards
        if (name.startsWith("home_") && league.hasStat(name.substring(5))) {
            return Optional.of(new FeatureDefinition(name, FeatureKind.RAW_HOME, name.substring(5), 0));
        }
        if (name.startsWith("away_") && league.hasStat(name.substring(5))) {
            return Optional.of(new FeatureDefinition(name, FeatureKind.RAW_AWAY, name.substring(5), 0));
        }
        if (name.endsWith("_diff") && league.hasStat(name.substring(0, name.length() - 5))) {
            return Optional.of(new FeatureDefinition(name, FeatureKind.DIFF, name.substring(0, name.length() - 5), 0));
        }
        if (name.startsWith("total_") && league.hasStat(name.substring(6))) {
            return Optional.of(new FeatureDefinition(name, FeatureKind.TOTAL, name.substring(6), 0));
        }
        return Optional.empty();
    }

    public GeneratedFeature describe(FeatureDefinition def) {
        String stat = def.stat();
        int w = def.window();
        return switch (def.kind()) {
            case RAW_HOME -> feature(def, "home." + stat, FeatureCategory.RAW, inferGroup(stat), FeatureTiming.POST_GAME);
            case RAW_AWAY -> feature(def, "away." + stat, FeatureCategory.RAW, inferGroup(stat), FeatureTiming.POST_GAME);
            case DIFF -> feature(def, "home." + stat + " - away." + stat, FeatureCategory.DIFFERENTIAL, inferGroup(stat), FeatureTiming.POST_GAME);
            case TOTAL -> feature(def, "home." + stat + " + away." + stat, FeatureCategory.COMBINED, inferGroup(stat), FeatureTiming.POST_GAME);
            case REST_HOME -> feature(def, "days since home team's previous game (same season)", FeatureCategory.SITUATIONAL, "situational", FeatureTiming.PRE_GAME);
            case REST_AWAY -> feature(def, "days since away team's previous game (same season)", FeatureCategory.SITUATIONAL, "situational", FeatureTiming.PRE_GAME);
            case REST_ADVANTAGE -> feature(def, "home_rest_days - away_rest_days", FeatureCategory.SITUATIONAL, "situational", FeatureTiming.PRE_GAME);
            case ROLLING_HOME -> feature(def, "mean(home." + stat + ", last " + w + " games before game date)", FeatureCategory.ROLLING, inferGroup(stat), FeatureTiming.PRE_GAME);
            case ROLLING_AWAY -> feature(def, "mean(away." + stat + ", last " + w + " games before game date)", FeatureCategory.ROLLING, inferGroup(stat), FeatureTiming.PRE_GAME);
            case ROLLING_DIFF -> feature(def, "rolling_" + stat + "_" + w + "_home - rolling_" + stat + "_" + w + "_away", FeatureCategory.ROLLING, inferGroup(stat), FeatureTiming.PRE_GAME);
        };
    }

    static String inferGroup(String stat) {
        if (stat == null) {
            return "other";
        }
        List<String> tokens = Arrays.asList(stat.toLowerCase().split("_"));
        if (tokens.stream().anyMatch(EFFICIENCY_TOKENS::contains)) {
            return "efficiency";
        }
        if (tokens.stream().anyMatch(t -> t.startsWith("rebound"))) {
            return "rebounding";
        }
        if (tokens.stream().anyMatch(DISCIPLINE_TOKENS::contains)) {
            return "discipline";
        }
        if (tokens.stream().anyMatch(PACE_TOKENS::contains)) {
            return "pace";
        }
        if (tokens.stream().anyMatch(SCORING_TOKENS::contains)) {
            return "scoring";
        }
        return "other";
    }

    private static GeneratedFeature feature(FeatureDefinition def, String formula, FeatureCategory category,
                                            String group, FeatureTiming timing) {
        return GeneratedFeature.builder()
                .name(def.name())
                .formula(formula)
                .category(category)
                .group(group)
                .timing(timing)
                .build();
    }

    private static String summarize(int featureCount, int statCount, boolean rest, boolean rolling,
                                    int window, List<String> skipped) {
        StringBuilder sb = new StringBuilder()
                .append(featureCount).append(" features generated from ").append(statCount).append(" stats");
        if (rest) {
            sb.append(" + rest days");
        }
        if (rolling) {
            sb.append(" + rolling(").append(window).append(")");
        }
        if (!skipped.isEmpty()) {
            sb.append("; skipped unknown stats: ").append(String.join(", ", skipped));
        }
        return sb.toString();
    }
}
