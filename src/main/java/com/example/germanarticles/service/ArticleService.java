package com.example.germanarticles.service;

import com.example.germanarticles.model.ArticlePayload;
import com.example.germanarticles.model.ArticleRequest;
import com.example.germanarticles.model.ArticleResponse;
import com.example.germanarticles.model.EmptyWordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Article lookup pipeline shared by the HTTP, Telegram and console channels.
 * Pipeline:
 * 1. Request normalization (empty words never reach the model)
 * 2. Prompt rendering
 * 3. Model call
 * 4. JSON extraction from the candidates
 * 5. Classification into success or failure
 */
@Service
public class ArticleService {

    private static final Logger log = LoggerFactory.getLogger(ArticleService.class);

    static final String PARSE_FAILURE = "Failed to parse AI response";

    private final ArticlePromptCompiler promptCompiler;
    private final GenerationClient generationClient;
    private final ArticleResponseExtractor extractor;
    private final ArticleResultClassifier classifier;

    public ArticleService(ArticlePromptCompiler promptCompiler,
                          GenerationClient generationClient,
                          ArticleResponseExtractor extractor,
                          ArticleResultClassifier classifier) {
        this.promptCompiler = promptCompiler;
        this.generationClient = generationClient;
        this.extractor = extractor;
        this.classifier = classifier;
    }

    /**
     * Looks up article, translation and case examples for a word.
     *
     * @param word     raw word as entered by the user
     * @param language raw language code of the reader, may be empty
     * @return a success or failure response; input, model and parsing problems are failures
     * @throws GenerationException if the model could not be called
     */
    public ArticleResponse determineArticle(String word, String language) {
        ArticleRequest request;
        try {
            request = ArticleRequest.of(word, language);
        } catch (EmptyWordException e) {
            log.warn("Invalid article request: word='{}', language='{}'", word, language);
            return ArticleResponse.failure(e.getMessage());
        }
        return determineArticle(request);
    }

    public ArticleResponse determineArticle(ArticleRequest request) {
        log.info("Processing article request: word='{}', language='{}'", request.word(), request.language());

        String prompt = promptCompiler.compile(request);
        var candidates = generationClient.generate(prompt);

        ArticlePayload payload;
        try {
            payload = extractor.extract(candidates);
        } catch (ExtractionException e) {
            log.error("Could not extract an answer for word='{}', language='{}' from {} candidate(s): {}",
                    request.word(), request.language(), candidates.size(), e.getMessage());
            return ArticleResponse.failure(PARSE_FAILURE);
        }

        ArticleResponse response = classifier.classify(payload);
        if (response.success()) {
            log.info("Article request for '{}' answered with {} interpretation(s)",
                    request.word(), response.data().size());
        } else {
            log.info("Article request for '{}' rejected by the model: {}", request.word(), response.error());
        }
        return response;
    }
}
