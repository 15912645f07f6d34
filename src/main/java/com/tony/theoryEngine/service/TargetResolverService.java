package com.tony.theoryEngine.service;

import com.tony.theoryEngine.model.dto.TargetDefinition;
import com.tony.theoryEngine.model.engine.BetOutcome;
import com.tony.theoryEngine.model.engine.ClosingLine;
import com.tony.theoryEngine.model.engine.CohortRow;
import com.tony.theoryEngine.model.engine.GameSnapshot;
import com.tony.theoryEngine.model.engine.MarketType;
import com.tony.theoryEngine.model.engine.OddsAssumption;
import com.tony.theoryEngine.util.OddsUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Résout la valeur de la cible (et l'issue du pari pour les cibles marché) de chaque match.
 */
@Service
public class TargetResolverService {

    public List<CohortRow> buildRows(List<GameSnapshot> games, Map<Long, Map<String, Object>> features,
                                     TargetDefinition target) {
        String side = TargetDefinitions.sideOf(target);
        List<CohortRow> rows = new ArrayList<>(games.size());
        for (GameSnapshot game : games) {
            CohortRow.CohortRowBuilder row = CohortRow.builder()
                    .gameId(game.id())
                    .gameDate(game.gameDay())
                    .season(game.season())
                    .homeTeam(game.homeTeam().name())
                    .awayTeam(game.awayTeam().name())
                    .homeScore(game.homeScore())
                    .awayScore(game.awayScore())
                    .side(side)
                    .features(features.getOrDefault(game.id(), new LinkedHashMap<>()))
                    .triggerReasons(List.of());
            if (target.isMarket()) {
                resolveMarket(row, game, target);
            } else {
                resolveStat(row, game, target.getTargetName());
            }
            rows.add(row.build());
        }
        return rows;
    }

    private void resolveStat(CohortRow.CohortRowBuilder row, GameSnapshot game, String targetName) {
        int home = game.homeScore();
        int away = game.awayScore();
        switch (targetName) {
            case TargetDefinitions.COMBINED_SCORE -> row.targetValue((double) (home + away));
            case TargetDefinitions.MARGIN_OF_VICTORY -> row.targetValue((double) (home - away));
            case TargetDefinitions.HOME_POINTS -> row.targetValue((double) home);
            case TargetDefinitions.AWAY_POINTS -> row.targetValue((double) away);
            case TargetDefinitions.HOME_WIN -> binary(row, home, away);
            case TargetDefinitions.AWAY_WIN -> binary(row, away, home);
            default -> throw new IllegalArgumentException("Cible stat non supportée : " + targetName);
        }
    }

    private static void binary(CohortRow.CohortRowBuilder row, int own, int other) {
        BetOutcome outcome = own > other ? BetOutcome.WIN : own < other ? BetOutcome.LOSS : BetOutcome.PUSH;
        row.outcome(outcome).targetValue(toTarget(outcome));
    }

    private void resolveMarket(CohortRow.CohortRowBuilder row, GameSnapshot game, TargetDefinition target) {
        MarketType market = target.getMarketType();
        String side = target.getSide();
        Optional<ClosingLine> quote = game.closingLine(market, side);
        Optional<ClosingLine> opposite = game.closingLine(market, opposite(market, side));

        Double line = null;
        if (market != MarketType.MONEYLINE) {
            line = quote.map(ClosingLine::line)
                    .or(() -> opposite.map(ClosingLine::line).map(l -> market == MarketType.SPREAD ? -l : l))
                    .orElse(null);
        }
        boolean quoted = quote.isPresent() || (market != MarketType.MONEYLINE && opposite.isPresent());
        Double price = target.getOddsAssumption() == OddsAssumption.FLAT_MINUS_110
                ? (quoted ? OddsUtils.FLAT_REFERENCE_PRICE : null)
                : quote.map(ClosingLine::price).orElse(null);

        BetOutcome outcome = settle(market, side, game.homeScore(), game.awayScore(), line);
        row.line(line)
                .price(price)
                .impliedProb(OddsUtils.impliedProbability(price))
                .outcome(outcome)
                .targetValue(toTarget(outcome));
    }

    static BetOutcome settle(MarketType market, String side, int homeScore, int awayScore, Double line) {
        switch (market) {
            case SPREAD: {
                if (line == null) {
                    return null;
                }
                double margin = "home".equals(side) ? homeScore - awayScore : awayScore - homeScore;
                return compare(margin + line, 0.0);
            }
            case TOTAL: {
                if (line == null) {
                    return null;
                }
                double total = homeScore + awayScore;
                return "over".equals(side) ? compare(total, line) : compare(line, total);
            }
            case MONEYLINE:
            default: {
                int own = "home".equals(side) ? homeScore : awayScore;
                int other = "home".equals(side) ? awayScore : homeScore;
                return compare(own, other);
            }
        }
    }

    private static BetOutcome compare(double value, double threshold) {
        if (value > threshold) {
            return BetOutcome.WIN;
        }
        return value < threshold ? BetOutcome.LOSS : BetOutcome.PUSH;
    }

    private static Double toTarget(BetOutcome outcome) {
        if (outcome == BetOutcome.WIN) {
            return 1.0;
        }
        return outcome == BetOutcome.LOSS ? 0.0 : null;
    }

    private static String opposite(MarketType market, String side) {
        if (market == MarketType.TOTAL) {
            return "over".equals(side) ? "under" : "over";
        }
        return "home".equals(side) ? "away" : "home";
    }
}
