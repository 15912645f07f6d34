package com.tony.theoryEngine.model.engine;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.time.MonthDay;

/**
 * Découpage calendaire NCAAB. La saison {@code s} démarre en novembre de l'année {@code s}.
 * Les bornes sont inclusives au début, exclusives à la fin.
 */
public enum GamePhase {
    ALL("all", null, 0, null, 0),
    OUT_CONF("out_conf", MonthDay.of(11, 1), 0, MonthDay.of(1, 1), 1),
    CONF("conf", MonthDay.of(1, 1), 1, MonthDay.of(3, 16), 1),
    POSTSEASON("postseason", MonthDay.of(3, 16), 1, MonthDay.of(4, 16), 1);

    private final String code;
    private final MonthDay start;
    private final int startYearOffset;
    private final MonthDay end;
    private final int endYearOffset;

    GamePhase(String code, MonthDay start, int startYearOffset, MonthDay end, int endYearOffset) {
        this.code = code;
        this.start = start;
        this.startYearOffset = startYearOffset;
        this.end = end;
        this.endYearOffset = endYearOffset;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean contains(LocalDate date, int season) {
        if (this == ALL) {
            return true;
        }
        LocalDate from = start.atYear(season + startYearOffset);
        LocalDate to = end.atYear(season + endYearOffset);
        return !date.isBefore(from) && date.isBefore(to);
    }
}
