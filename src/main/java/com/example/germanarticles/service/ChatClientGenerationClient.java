package com.example.germanarticles.service;

import com.example.germanarticles.config.ArticleProperties;
import com.example.germanarticles.model.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link GenerationClient} backed by a Spring AI {@link ChatClient}, with automatic retry.
 * <p>
 * Every {@link Generation} of the chat response becomes one {@link Candidate}. A generation
 * whose finish reason names a content filter or a safety block is reported as filtered.
 * Failed calls are retried up to {@code german-articles.ai.max-retries} times with a linear
 * backoff; attempts run one after another, never concurrently.
 */
@Service
public class ChatClientGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(ChatClientGenerationClient.class);

    private final ChatClient chatClient;
    private final int maxRetries;
    private final long backoffMillis;

    public ChatClientGenerationClient(@Qualifier("articleChatClient") ChatClient chatClient,
                                      ArticleProperties properties) {
        this.chatClient = chatClient;
        this.maxRetries = Math.max(0, properties.ai().maxRetries());
        this.backoffMillis = properties.ai().retryBackoff().toMillis();
    }

    @Override
    public List<Candidate> generate(String prompt) {
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxRetries + 1; attempt++) {
            try {
                ChatResponse chatResponse = chatClient.prompt()
                        .user(prompt)
                        .call()
                        .chatResponse();

                logTokenUsage(chatResponse);
                return toCandidates(chatResponse);
            } catch (Exception e) {
                lastError = e;
                if (attempt <= maxRetries) {
                    long delay = attempt * backoffMillis;
                    log.warn("Model call attempt {}/{} failed ({}), retrying in {}ms...",
                            attempt, maxRetries + 1, rootCauseMessage(e), delay);
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }
        throw new GenerationException("Model call failed after " + (maxRetries + 1)
                + " attempts: " + rootCauseMessage(lastError), lastError);
    }

    private static List<Candidate> toCandidates(ChatResponse chatResponse) {
        if (chatResponse == null || chatResponse.getResults() == null) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        for (Generation generation : chatResponse.getResults()) {
            if (isFiltered(generation)) {
                candidates.add(Candidate.filtered());
                continue;
            }
            String text = generation.getOutput() != null ? generation.getOutput().getText() : null;
            candidates.add(Candidate.ofText(text));
        }
        return candidates;
    }

    private static boolean isFiltered(Generation generation) {
        if (generation.getMetadata() == null || generation.getMetadata().getFinishReason() == null) {
            return false;
        }
        String reason = generation.getMetadata().getFinishReason().toLowerCase(Locale.ROOT);
        return reason.contains("filter") || reason.contains("safety") || reason.contains("refusal");
    }

    private static void logTokenUsage(ChatResponse chatResponse) {
        if (chatResponse == null || chatResponse.getMetadata() == null) return;
        var metadata = chatResponse.getMetadata();
        var usage = metadata.getUsage();
        if (usage == null || usage.getTotalTokens() == null) return;
        log.debug("Model {} used {} tokens ({} prompt, {} completion)",
                metadata.getModel(), usage.getTotalTokens(),
                usage.getPromptTokens(), usage.getCompletionTokens());
    }

    private static String rootCauseMessage(Throwable e) {
        if (e == null) {
            return "no attempt was made";
        }
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return msg != null && msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}
