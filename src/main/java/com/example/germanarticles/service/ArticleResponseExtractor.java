package com.example.germanarticles.service;

import com.example.germanarticles.model.ArticlePayload;
import com.example.germanarticles.model.Candidate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recovers the JSON answer from the model's free-text candidates.
 * <p>
 * Models wrap the requested JSON in Markdown fences or prose and regularly leave
 * trailing commas behind. For each candidate, in order:
 * <ol>
 *   <li>skip it when it was filtered or carries no text</li>
 *   <li>cut the span from the first {@code '{'} to the last {@code '}'}</li>
 *   <li>drop commas that directly precede a closing {@code '}'} or {@code ']'}</li>
 *   <li>parse the result into an {@link ArticlePayload}</li>
 * </ol>
 * The first candidate that parses wins; a malformed candidate is logged and skipped.
 */
@Service
public class ArticleResponseExtractor {

    private static final Logger log = LoggerFactory.getLogger(ArticleResponseExtractor.class);

    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");

    /** Lenient ObjectMapper that tolerates comments, single quotes, key casing and unexpected fields. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Parses the first usable candidate.
     *
     * @param candidates completions in provider order
     * @return the parsed payload
     * @throws ExtractionException if the list is empty or no candidate parses
     */
    public ArticlePayload extract(List<Candidate> candidates) throws ExtractionException {
        if (candidates == null || candidates.isEmpty()) {
            log.warn("No candidates in model response");
            throw new ExtractionException("no parsable candidate");
        }

        for (int i = 0; i < candidates.size(); i++) {
            Candidate candidate = candidates.get(i);
            if (candidate.contentFiltered()) {
                log.warn("Candidate {} was withheld by the provider's content filter", i);
                continue;
            }
            if (!candidate.hasText()) {
                log.warn("Candidate {} has no text content", i);
                continue;
            }

            String raw = candidate.text();
            Optional<String> json = cleanJson(raw);
            if (json.isEmpty()) {
                log.warn("Candidate {} contains no JSON object: {}", i, raw);
                continue;
            }

            try {
                return LENIENT_MAPPER.readValue(json.get(), ArticlePayload.class);
            } catch (JsonProcessingException e) {
                log.warn("Candidate {} could not be parsed ({}): {}", i, e.getOriginalMessage(), raw);
            }
        }

        throw new ExtractionException("no parsable candidate");
    }

    /**
     * Isolates the outermost JSON object in the text and removes trailing commas.
     *
     * @return the repaired JSON, or empty when the text has no {@code {...}} span
     */
    static Optional<String> cleanJson(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end < start) {
            return Optional.empty();
        }
        String json = text.substring(start, end + 1).trim();
        return Optional.of(TRAILING_COMMA.matcher(json).replaceAll("$1"));
    }
}
