package com.example.germanarticles.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Configuration properties for the article lookup service.
 */
@ConfigurationProperties(prefix = "german-articles")
public record ArticleProperties(
        @DefaultValue Ai ai,
        @DefaultValue Telegram telegram
) {

    /**
     * Settings for calls to the generative model.
     *
     * @param maxRetries   retries after a failed model call (0 disables retrying)
     * @param retryBackoff base delay between attempts, multiplied by the attempt number
     */
    public record Ai(
            @DefaultValue("2") int maxRetries,
            @DefaultValue("2s") Duration retryBackoff
    ) {}

    /**
     * Configuration for the Telegram bot.
     *
     * @param token  bot token; the bot is disabled when blank
     * @param apiUrl base URL of the Telegram Bot API
     */
    public record Telegram(
            String token,
            @DefaultValue("https://api.telegram.org") String apiUrl
    ) {}
}
