package com.tony.theoryEngine.util;

import com.tony.theoryEngine.model.engine.BetOutcome;

/**
 * Cotes américaines, mise unitaire.
 */
public final class OddsUtils {

    public static final double FLAT_REFERENCE_PRICE = -110.0;

    private OddsUtils() {
    }

    public static Double impliedProbability(Double americanPrice) {
        if (americanPrice == null || americanPrice == 0.0) {
            return null;
        }
        double p = americanPrice;
        return p < 0 ? -p / (-p + 100.0) : 100.0 / (p + 100.0);
    }

    // Gain net pour 1 unité risquée en cas de victoire
    public static double profitPerUnit(double americanPrice) {
        return americanPrice > 0 ? americanPrice / 100.0 : 100.0 / Math.abs(americanPrice);
    }

    public static double unitPnl(BetOutcome outcome, double americanPrice) {
        if (outcome == null) {
            return 0.0;
        }
        return switch (outcome) {
            case WIN -> profitPerUnit(americanPrice);
            case LOSS -> -1.0;
            case PUSH -> 0.0;
        };
    }
}
