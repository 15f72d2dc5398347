package com.example.germanarticles.model;

/**
 * German grammatical cases in declension order.
 */
public enum GrammaticalCase {
    NOMINATIVE("Nominative"),
    ACCUSATIVE("Accusative"),
    DATIVE("Dative"),
    GENITIVE("Genitive");

    private final String label;

    GrammaticalCase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
