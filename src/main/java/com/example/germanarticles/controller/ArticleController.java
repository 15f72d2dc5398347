package com.example.germanarticles.controller;

import com.example.germanarticles.model.ArticleResponse;
import com.example.germanarticles.service.ArticleResponseFormatter;
import com.example.germanarticles.service.ArticleService;
import com.example.germanarticles.service.Channel;
import com.example.germanarticles.service.GenerationException;
import com.example.germanarticles.telegram.TelegramBotHandler;
import com.example.germanarticles.telegram.TelegramUpdate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for article lookups.
 * <p>
 * The root path also receives the Telegram webhook: a POSTed body with a positive
 * {@code update_id} is handed to the bot instead of being treated as an API request.
 */
@RestController
@CrossOrigin(origins = "*",
        methods = {RequestMethod.GET, RequestMethod.POST, RequestMethod.OPTIONS},
        allowedHeaders = {"Content-Type", "Accept-Language", "Authorization"},
        maxAge = 86400)
public class ArticleController {

    private static final Logger log = LoggerFactory.getLogger(ArticleController.class);

    private final ArticleService articleService;
    private final ArticleResponseFormatter formatter;
    private final ObjectMapper objectMapper;
    private final ObjectProvider<TelegramBotHandler> telegramBotHandler;

    public ArticleController(ArticleService articleService,
                             ArticleResponseFormatter formatter,
                             ObjectMapper objectMapper,
                             ObjectProvider<TelegramBotHandler> telegramBotHandler) {
        this.articleService = articleService;
        this.formatter = formatter;
        this.objectMapper = objectMapper;
        this.telegramBotHandler = telegramBotHandler;
    }

    /**
     * Looks up a word passed as query parameter.
     *
     * <p>Endpoint: GET /?word=Haus or GET /article?word=Haus
     * <p>The answer language is taken from the Accept-Language header.
     */
    @GetMapping(value = {"/", "/article"}, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> lookup(
            @RequestParam(value = "word", required = false) String word,
            @RequestHeader(value = HttpHeaders.ACCEPT_LANGUAGE, required = false) String acceptLanguage) {
        return respond(word, acceptLanguage);
    }

    /**
     * Looks up a word passed as JSON body ({@code {"word": "Haus"}}), or processes a
     * Telegram webhook update.
     *
     * <p>Endpoint: POST / or POST /article
     */
    @PostMapping(value = {"/", "/article"}, consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> lookupOrUpdate(
            @RequestBody JsonNode body,
            @RequestHeader(value = HttpHeaders.ACCEPT_LANGUAGE, required = false) String acceptLanguage) {
        TelegramBotHandler bot = telegramBotHandler.getIfAvailable();
        if (bot != null && body.path("update_id").asLong() > 0) {
            return handleTelegramUpdate(bot, body);
        }
        JsonNode word = body.path("word");
        if (!word.isMissingNode() && !word.isNull() && !word.isTextual()) {
            log.warn("Rejecting non-string word of type {}", word.getNodeType());
            return error("Invalid JSON format", HttpStatus.BAD_REQUEST);
        }
        return respond(word.asText(""), acceptLanguage);
    }

    /**
     * Liveness check.
     *
     * <p>Endpoint: GET /health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<String> invalidBody(HttpMessageNotReadableException e) {
        log.warn("Failed to decode JSON body: {}", e.getMostSpecificCause().getMessage());
        return error("Invalid JSON format", HttpStatus.BAD_REQUEST);
    }

    private ResponseEntity<String> respond(String word, String acceptLanguage) {
        if (word == null || word.isEmpty()) {
            return error("Word parameter is required", HttpStatus.BAD_REQUEST);
        }
        if (acceptLanguage == null || acceptLanguage.isBlank()) {
            log.debug("No language specified, defaulting to 'en'");
        }

        try {
            ArticleResponse response = articleService.determineArticle(word, acceptLanguage);
            return json(response, HttpStatus.OK);
        } catch (GenerationException e) {
            log.error("Article lookup for '{}' failed", word, e);
            return error("Internal server error", HttpStatus.INTERNAL_SERVER_ERROR);
        }
    }

    private ResponseEntity<String> handleTelegramUpdate(TelegramBotHandler bot, JsonNode body) {
        try {
            bot.handle(objectMapper.treeToValue(body, TelegramUpdate.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable Telegram update: {}", e.getOriginalMessage());
        } catch (RuntimeException e) {
            // Telegram redelivers updates that are not acknowledged with 200
            log.error("Failed to process Telegram update {}", body.path("update_id").asLong(), e);
        }
        return ResponseEntity.ok().build();
    }

    private ResponseEntity<String> error(String message, HttpStatus status) {
        return json(ArticleResponse.failure(message), status);
    }

    private ResponseEntity<String> json(ArticleResponse response, HttpStatus status) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(formatter.format(response, Channel.API));
    }
}
