package com.example.germanarticles.model;

import java.util.Locale;

/**
 * A single lookup: the German word and the language the answer is written in.
 *
 * @param word     the noun as typed by the user, stripped of Unicode whitespace
 * @param language primary language subtag of the reader (e.g. "en", "ru")
 */
public record ArticleRequest(
        String word,
        String language
) {

    public static final String DEFAULT_LANGUAGE = "en";

    public ArticleRequest {
        word = word == null ? "" : word.strip();
        if (word.isEmpty()) {
            throw new EmptyWordException();
        }
        language = normalizeLanguage(language);
    }

    /**
     * Builds a request from raw channel input.
     *
     * @param word     raw word, surrounding whitespace is dropped
     * @param language raw language code, may be empty or carry region/quality suffixes
     *                 such as {@code en-US,en;q=0.9}
     * @return the normalized request
     * @throws EmptyWordException if the word is empty after trimming
     */
    public static ArticleRequest of(String word, String language) {
        return new ArticleRequest(word, language);
    }

    /**
     * Reduces a language code or an Accept-Language value to its primary subtag.
     */
    static String normalizeLanguage(String language) {
        if (language == null || language.isBlank()) {
            return DEFAULT_LANGUAGE;
        }
        String primary = language.split("[-;,_]", 2)[0].trim();
        return primary.isEmpty() ? DEFAULT_LANGUAGE : primary.toLowerCase(Locale.ROOT);
    }
}
