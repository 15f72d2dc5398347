package com.example.germanarticles.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subset of a Telegram Bot API update delivered to the webhook.
 *
 * @param updateId unique, positive update identifier
 * @param message  the incoming message, absent for other update kinds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TelegramUpdate(
        @JsonProperty("update_id") long updateId,
        Message message
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(
            @JsonProperty("message_id") long messageId,
            User from,
            Chat chat,
            String text
    ) {}

    /**
     * @param languageCode IETF language tag of the user's client, may be absent
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(
            long id,
            @JsonProperty("language_code") String languageCode
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chat(long id) {}
}
