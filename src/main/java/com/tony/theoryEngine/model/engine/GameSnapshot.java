package com.tony.theoryEngine.model.engine;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Copie en lecture seule d'un match joué, avec ses boxscores et ses lignes de clôture.
 */
public record GameSnapshot(
        Long id,
        int season,
        LocalDateTime gameDate,
        TeamRef homeTeam,
        TeamRef awayTeam,
        int homeScore,
        int awayScore,
        Map<String, Object> homeStats,
        Map<String, Object> awayStats,
        List<ClosingLine> closingLines
) {
    public static final Comparator<GameSnapshot> CHRONOLOGICAL =
            Comparator.comparing(GameSnapshot::gameDate).thenComparing(GameSnapshot::id);

    public LocalDate gameDay() {
        return gameDate.toLocalDate();
    }

    public Map<String, Object> statsFor(boolean home) {
        return home ? homeStats : awayStats;
    }

    public TeamRef team(boolean home) {
        return home ? homeTeam : awayTeam;
    }

    // Plusieurs books possibles : on prend le premier par ordre alphabétique pour rester déterministe
    public Optional<ClosingLine> closingLine(MarketType market, String side) {
        if (closingLines == null) {
            return Optional.empty();
        }
        return closingLines.stream()
                .filter(l -> market.getCode().equalsIgnoreCase(l.marketType()))
                .filter(l -> side.equalsIgnoreCase(l.side()))
                .min(Comparator.comparing(ClosingLine::book, Comparator.nullsLast(Comparator.naturalOrder())));
    }

    public boolean hasAnyClosingLine() {
        return closingLines != null && !closingLines.isEmpty();
    }
}
