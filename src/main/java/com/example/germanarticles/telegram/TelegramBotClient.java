package com.example.germanarticles.telegram;

import com.example.germanarticles.config.ArticleProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * HTTP client for the Telegram Bot API.
 */
public class TelegramBotClient {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotClient.class);

    public static final String PARSE_MODE_HTML = "HTML";

    private final RestClient restClient;

    public TelegramBotClient(RestClient.Builder builder, ArticleProperties.Telegram properties) {
        this.restClient = builder
                .baseUrl(properties.apiUrl() + "/bot" + properties.token())
                .build();
    }

    /**
     * Sends a text message to a chat.
     *
     * @param chatId    target chat
     * @param text      message body
     * @param parseMode Telegram parse mode ({@value #PARSE_MODE_HTML}) or {@code null} for plain text
     * @throws org.springframework.web.client.RestClientException if the Bot API rejects the call
     */
    public void sendMessage(long chatId, String text, String parseMode) {
        log.debug("Sending message to chat {} ({} chars)", chatId, text.length());
        restClient.post()
                .uri("/sendMessage")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new SendMessage(chatId, text, parseMode))
                .retrieve()
                .toBodilessEntity();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SendMessage(
            @JsonProperty("chat_id") long chatId,
            String text,
            @JsonProperty("parse_mode") String parseMode
    ) {}
}
