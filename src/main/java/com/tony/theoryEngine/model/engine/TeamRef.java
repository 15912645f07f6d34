package com.tony.theoryEngine.model.engine;

public record TeamRef(Long id, String name, String shortName, String abbreviation) {

    /**
     * Sous-chaîne insensible à la casse sur le nom, le nom court ou l'abréviation.
     */
    public boolean matches(String needle) {
        if (needle == null || needle.isBlank()) {
            return true;
        }
        String n = needle.trim().toLowerCase();
        return contains(name, n) || contains(shortName, n) || contains(abbreviation, n);
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase().contains(needle);
    }
}
