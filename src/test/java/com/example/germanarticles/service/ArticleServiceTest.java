package com.example.germanarticles.service;

import com.example.germanarticles.model.ArticleResponse;
import com.example.germanarticles.model.Candidate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArticleServiceTest {

    @Mock
    private GenerationClient generationClient;

    private ArticleService service;
    private ArticleResponseFormatter formatter;

    @BeforeEach
    void setUp() {
        service = new ArticleService(new ArticlePromptCompiler(), generationClient,
                new ArticleResponseExtractor(), new ArticleResultClassifier());
        formatter = new ArticleResponseFormatter(new ObjectMapper(), new ChatMessageFormatter());
    }

    @Test
    void cleanAnswerIsReturnedAsSuccess() throws IOException {
        when(generationClient.generate(contains("The word is: \"Haus\"")))
                .thenReturn(List.of(Candidate.ofText(fixture("haus-response.json"))));

        ArticleResponse response = service.determineArticle("Haus", "en");

        assertThat(response.success()).isTrue();
        assertThat(response.data()).hasSize(1);
        assertThat(response.data().get(0).wordWithArticle()).isEqualTo("das Haus");
        assertThat(formatter.format(response, Channel.API))
                .startsWith("{\"success\":true,\"data\":[{\"wordWithArticle\":\"das Haus\"");
    }

    @Test
    void modelRejectionIsReturnedAsFailure() {
        when(generationClient.generate(anyString()))
                .thenReturn(List.of(Candidate.ofText("{\"error\":true,\"errorMessage\":\"Not a German noun\"}")));

        ArticleResponse response = service.determineArticle("xyz123", "en");

        assertThat(formatter.format(response, Channel.API))
                .isEqualTo("{\"success\":false,\"error\":\"Not a German noun\"}");
    }

    @Test
    void emptyWordNeverReachesTheModel() {
        ArticleResponse response = service.determineArticle("", "en");

        assertThat(formatter.format(response, Channel.API))
                .isEqualTo("{\"success\":false,\"error\":\"Word cannot be empty\"}");
        verifyNoInteractions(generationClient);
    }

    @Test
    void unicodeSpacesOnlyNeverReachTheModel() {
        ArticleResponse response = service.determineArticle("\u2003\u3000", "en");

        assertThat(response.error()).isEqualTo("Word cannot be empty");
        verifyNoInteractions(generationClient);
    }

    @Test
    void fencedEmptyAnswerRendersNoInformation() {
        when(generationClient.generate(anyString())).thenReturn(List.of(Candidate.ofText(
                "```json\n{\"error\":false,\"data\":[]}\n```\nI hope this helps!")));

        ArticleResponse response = service.determineArticle("Haus", "en");

        assertThat(response.success()).isTrue();
        assertThat(response.data()).isEmpty();
        assertThat(formatter.format(response, Channel.CHAT)).isEqualTo(ChatMessageFormatter.NO_INFORMATION);
    }

    @Test
    void unparsableAnswerIsFailure() {
        when(generationClient.generate(anyString()))
                .thenReturn(List.of(Candidate.ofText("I am not sure."), Candidate.filtered()));

        ArticleResponse response = service.determineArticle("Haus", "en");

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo(ArticleService.PARSE_FAILURE);
    }

    @Test
    void noCandidatesIsFailure() {
        when(generationClient.generate(anyString())).thenReturn(List.of());

        assertThat(service.determineArticle("Haus", "en").error()).isEqualTo(ArticleService.PARSE_FAILURE);
    }

    @Test
    void upstreamFailurePropagates() {
        when(generationClient.generate(anyString()))
                .thenThrow(new GenerationException("quota exceeded", null));

        assertThatThrownBy(() -> service.determineArticle("Haus", "en"))
                .isInstanceOf(GenerationException.class)
                .hasMessage("quota exceeded");
    }

    @Test
    void promptUsesNormalizedRequest() {
        when(generationClient.generate(anyString()))
                .thenReturn(List.of(Candidate.ofText("{\"error\":false,\"data\":[]}")));

        service.determineArticle("  Katze ", "ru-RU,ru;q=0.9");

        verify(generationClient).generate(contains("The word is: \"Katze\""));
        verify(generationClient).generate(contains("translation in Russian"));
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = ArticleServiceTest.class.getResourceAsStream("/fixtures/" + name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
