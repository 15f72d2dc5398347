package com.example.germanarticles.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of a lookup as returned to every channel.
 * <p>
 * A successful response carries {@code data} (possibly empty) and no error;
 * a failed one carries a non-blank {@code error} and no data. Use
 * {@link #success(List)} and {@link #failure(String)} to build instances.
 *
 * @param success whether the lookup produced an answer
 * @param error   user-facing error text, only when {@code success} is false
 * @param data    one entry per interpretation of the word, only when {@code success} is true
 */
public record ArticleResponse(
        boolean success,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) String error,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<ArticleInfo> data
) {

    public ArticleResponse {
        if (success) {
            if (error != null && !error.isEmpty()) {
                throw new IllegalArgumentException("A successful response cannot carry an error");
            }
            error = null;
            data = data == null ? List.of() : List.copyOf(data);
        } else {
            if (error == null || error.isBlank()) {
                throw new IllegalArgumentException("A failed response needs an error message");
            }
            if (data != null && !data.isEmpty()) {
                throw new IllegalArgumentException("A failed response cannot carry data");
            }
            data = List.of();
        }
    }

    public static ArticleResponse success(List<ArticleInfo> data) {
        return new ArticleResponse(true, null, data);
    }

    public static ArticleResponse failure(String error) {
        return new ArticleResponse(false, error, null);
    }
}
