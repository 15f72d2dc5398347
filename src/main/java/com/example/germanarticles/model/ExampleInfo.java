package com.example.germanarticles.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Examples for one grammatical number, with the definite and the indefinite article.
 */
public record ExampleInfo(
        TranslationsInfo definite,
        TranslationsInfo indefinite
) {

    public static final ExampleInfo EMPTY = new ExampleInfo(null, null);

    public ExampleInfo {
        definite = definite == null ? TranslationsInfo.EMPTY : definite;
        indefinite = indefinite == null ? TranslationsInfo.EMPTY : indefinite;
    }

    /** True when at least one case has both an example and its translation. */
    @JsonIgnore
    public boolean isPopulated() {
        return !definite.presentCases().isEmpty() || !indefinite.presentCases().isEmpty();
    }
}
