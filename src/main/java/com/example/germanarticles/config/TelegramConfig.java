package com.example.germanarticles.config;

import com.example.germanarticles.service.ArticleResponseFormatter;
import com.example.germanarticles.service.ArticleService;
import com.example.germanarticles.telegram.TelegramBotClient;
import com.example.germanarticles.telegram.TelegramBotHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Telegram bot wiring, active only when {@code german-articles.telegram.token} is set.
 */
@Configuration
@ConditionalOnExpression("!'${german-articles.telegram.token:}'.isBlank()")
public class TelegramConfig {

    private static final Logger log = LoggerFactory.getLogger(TelegramConfig.class);

    @Bean
    public TelegramBotClient telegramBotClient(RestClient.Builder restClientBuilder, ArticleProperties properties) {
        log.info("Telegram bot enabled, Bot API at {}", properties.telegram().apiUrl());
        return new TelegramBotClient(restClientBuilder, properties.telegram());
    }

    @Bean
    public TelegramBotHandler telegramBotHandler(TelegramBotClient telegramBotClient,
                                                 ArticleService articleService,
                                                 ArticleResponseFormatter formatter) {
        return new TelegramBotHandler(telegramBotClient, articleService, formatter);
    }
}
