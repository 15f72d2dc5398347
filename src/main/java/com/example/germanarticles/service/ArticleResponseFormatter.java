package com.example.germanarticles.service;

import com.example.germanarticles.model.ArticleResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.springframework.stereotype.Service;

/**
 * Projects an {@link ArticleResponse} into the representation of a {@link Channel}.
 */
@Service
public class ArticleResponseFormatter {

    private final ObjectWriter compactWriter;
    private final ObjectWriter prettyWriter;
    private final ChatMessageFormatter chatMessageFormatter;

    public ArticleResponseFormatter(ObjectMapper objectMapper, ChatMessageFormatter chatMessageFormatter) {
        this.compactWriter = objectMapper.writer();
        this.prettyWriter = objectMapper.writerWithDefaultPrettyPrinter();
        this.chatMessageFormatter = chatMessageFormatter;
    }

    public String format(ArticleResponse response, Channel channel) {
        return switch (channel) {
            case API -> toJson(compactWriter, response);
            case CONSOLE -> toJson(prettyWriter, response);
            case CHAT -> chatMessageFormatter.format(response);
        };
    }

    private static String toJson(ObjectWriter writer, ArticleResponse response) {
        try {
            return writer.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            // Records of strings and lists always serialize
            throw new IllegalStateException("Could not serialize article response", e);
        }
    }
}
