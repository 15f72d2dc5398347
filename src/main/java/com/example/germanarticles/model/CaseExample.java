package com.example.germanarticles.model;

/**
 * An example sentence in one grammatical case and its translation.
 */
public record CaseExample(
        String example,
        String translation
) {

    public boolean isPresent() {
        return example != null && !example.isBlank()
                && translation != null && !translation.isBlank();
    }
}
