package com.example.germanarticles.model;

import java.util.List;

/**
 * Wrapper for parsing the JSON object the model answers with.
 *
 * @param error        true when the model rejected the input
 * @param errorMessage explanation in the reader's language, set when {@code error} is true
 * @param data         interpretations of the word, set when {@code error} is false
 */
public record ArticlePayload(
        boolean error,
        String errorMessage,
        List<ArticleInfo> data
) {

    public ArticlePayload {
        errorMessage = errorMessage == null ? "" : errorMessage;
        data = data == null ? List.of() : List.copyOf(data);
    }
}
