package com.example.germanarticles.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ChatClient configuration for the article lookup.
 * <p>
 * The underlying {@link ChatModel} comes from the Spring AI starter selected with
 * {@code spring.ai.model.chat} ({@code openai} or {@code anthropic}).
 */
@Configuration
public class AiConfig {

    @Bean("articleChatClient")
    public ChatClient articleChatClient(ChatModel chatModel) {
        return ChatClient.builder(chatModel).build();
    }
}
