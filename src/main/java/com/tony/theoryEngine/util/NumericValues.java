package com.tony.theoryEngine.util;

/**
 * Conversion des valeurs de boxscore (JSON libre) en nombres.
 */
public final class NumericValues {

    private NumericValues() {
    }

    /**
     * @return la valeur numérique, ou {@code null} si absente ou non convertible.
     *         Les durées "mm:ss" sont converties en minutes.
     */
    public static Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0 : 0.0;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        if (text.matches("\\d{1,3}:\\d{2}")) {
            String[] parts = text.split(":");
            return Integer.parseInt(parts[0]) + Integer.parseInt(parts[1]) / 60.0;
        }
        try {
            double d = Double.parseDouble(text.endsWith("%") ? text.substring(0, text.length() - 1) : text);
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static boolean isNonNumeric(Object value) {
        return value != null && toDouble(value) == null;
    }
}
