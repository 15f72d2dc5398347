package com.example.germanarticles.model;

import java.util.List;

/**
 * One alternative completion returned by the generative model for a prompt.
 *
 * @param textParts       text fragments of the completion, in order
 * @param contentFiltered true when the provider withheld the content
 */
public record Candidate(
        List<String> textParts,
        boolean contentFiltered
) {

    public Candidate {
        textParts = textParts == null ? List.of() : List.copyOf(textParts);
    }

    public static Candidate ofText(String text) {
        return new Candidate(text == null ? List.of() : List.of(text), false);
    }

    public static Candidate filtered() {
        return new Candidate(List.of(), true);
    }

    /** Concatenated text of all parts; empty when the candidate carries no text. */
    public String text() {
        return String.join("", textParts);
    }

    public boolean hasText() {
        return !contentFiltered && !text().isBlank();
    }
}
