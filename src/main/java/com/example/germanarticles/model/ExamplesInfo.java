package com.example.germanarticles.model;

/**
 * Singular and plural usage examples of a noun.
 */
public record ExamplesInfo(
        ExampleInfo singular,
        ExampleInfo plural
) {

    public static final ExamplesInfo EMPTY = new ExamplesInfo(null, null);

    public ExamplesInfo {
        singular = singular == null ? ExampleInfo.EMPTY : singular;
        plural = plural == null ? ExampleInfo.EMPTY : plural;
    }
}
