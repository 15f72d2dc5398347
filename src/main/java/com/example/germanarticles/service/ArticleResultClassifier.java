package com.example.germanarticles.service;

import com.example.germanarticles.model.ArticlePayload;
import com.example.germanarticles.model.ArticleResponse;
import org.springframework.stereotype.Service;

/**
 * Turns the parsed model payload into the response returned to the channels.
 */
@Service
public class ArticleResultClassifier {

    static final String GENERIC_ERROR = "Failed to process request";

    /**
     * A payload flagged as an error becomes a failure carrying the model's (already localized)
     * message; anything else is a success, including one without interpretations.
     */
    public ArticleResponse classify(ArticlePayload payload) {
        if (payload.error()) {
            String message = payload.errorMessage().isBlank() ? GENERIC_ERROR : payload.errorMessage();
            return ArticleResponse.failure(message);
        }
        return ArticleResponse.success(payload.data());
    }
}
