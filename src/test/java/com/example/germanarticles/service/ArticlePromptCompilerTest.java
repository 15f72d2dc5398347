package com.example.germanarticles.service;

import com.example.germanarticles.model.ArticleRequest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ArticlePromptCompilerTest {

    private final ArticlePromptCompiler compiler = new ArticlePromptCompiler();

    @Test
    void substitutesWordIntoEveryExampleSlot() {
        String prompt = compiler.compile(ArticleRequest.of("Haus", "en"));

        assertThat(prompt).contains("The word is: \"Haus\"");
        // 2 numbers x 2 article kinds x 4 cases
        assertThat(countOccurrences(prompt, "using the word \\\"Haus\\\"")).isEqualTo(16);
        assertThat(prompt).doesNotContain("%1$s").doesNotContain("%2$s");
    }

    @Test
    void substitutesLanguageNameIntoEveryTranslationSlot() {
        String prompt = compiler.compile(ArticleRequest.of("Katze", "ru"));

        assertThat(countOccurrences(prompt, "definite example in Russian")).isEqualTo(16);
        assertThat(prompt).contains("\"translation\": \"translation in Russian\"");
        assertThat(prompt).contains("explain what's wrong in Russian language");
    }

    @Test
    void asksForJsonAndOneEntryPerInterpretation() {
        String prompt = compiler.compile(ArticleRequest.of("See", "en"));

        assertThat(prompt).contains("Respond ONLY with a JSON object");
        assertThat(prompt).contains("\"error\": false/true");
        assertThat(prompt).contains("include each as a separate object in the data array");
    }

    @Test
    void resolvesLanguageNames() {
        assertThat(ArticlePromptCompiler.languageName("en")).isEqualTo("English");
        assertThat(ArticlePromptCompiler.languageName("de")).isEqualTo("German");
        assertThat(ArticlePromptCompiler.languageName("uk")).isEqualTo("Ukrainian");
    }

    private static int countOccurrences(String text, String fragment) {
        int count = 0;
        for (int i = text.indexOf(fragment); i >= 0; i = text.indexOf(fragment, i + 1)) {
            count++;
        }
        return count;
    }
}
