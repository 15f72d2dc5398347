package com.example.germanarticles.service;

import com.example.germanarticles.model.ArticleInfo;
import com.example.germanarticles.model.ArticlePayload;
import com.example.germanarticles.model.ArticleResponse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ArticleResultClassifierTest {

    private final ArticleResultClassifier classifier = new ArticleResultClassifier();

    @Test
    void errorPayloadBecomesFailureWithModelMessage() {
        ArticleResponse response = classifier.classify(new ArticlePayload(true, "Это не существительное", null));

        assertThat(response.success()).isFalse();
        assertThat(response.error()).isEqualTo("Это не существительное");
        assertThat(response.data()).isEmpty();
    }

    @Test
    void errorPayloadWithoutMessageGetsGenericText() {
        ArticleResponse response = classifier.classify(new ArticlePayload(true, " ", null));

        assertThat(response.error()).isEqualTo(ArticleResultClassifier.GENERIC_ERROR);
    }

    @Test
    void dataIsPassedThroughInModelOrder() {
        List<ArticleInfo> data = List.of(
                new ArticleInfo("der Leiter", "the leader", null),
                new ArticleInfo("die Leiter", "the ladder", null));

        ArticleResponse response = classifier.classify(new ArticlePayload(false, "", data));

        assertThat(response.success()).isTrue();
        assertThat(response.error()).isNull();
        assertThat(response.data()).containsExactlyElementsOf(data);
    }

    @Test
    void emptyDataIsSuccess() {
        ArticleResponse response = classifier.classify(new ArticlePayload(false, null, List.of()));

        assertThat(response.success()).isTrue();
        assertThat(response.data()).isEmpty();
    }
}
