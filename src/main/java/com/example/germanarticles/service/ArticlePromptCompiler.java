package com.example.germanarticles.service;

import com.example.germanarticles.model.ArticleRequest;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Renders the instruction sent to the model for a single lookup.
 * <p>
 * The word ({@code %1$s}) and the reader's language name ({@code %2$s}) are placed into
 * every slot description of the expected JSON, so the model knows which noun to use in
 * each example and which language to translate into.
 */
@Service
public class ArticlePromptCompiler {

    private static final String PROMPT_TEMPLATE = """
            You are a German language assistant. I will provide you with a German noun (Nomen), and you need to determine the correct article (der, die, das).

            The word is: "%1$s"
            Respond ONLY with a JSON object with EXACTLY this structure:
            {
              "error": false/true,
              "errorMessage": "Only if there's an error, explain what's wrong in %2$s language",
              "data": [
                {
                  "wordWithArticle": "article + word in German",
                  "translation": "translation in %2$s",
                  "example": {
                    "singular": {
                      "definite": {
                        "nominativeExample": "simple example using the word \\"%1$s\\" in singular nominative definite case",
                        "nominativeTranslation": "translation of the singular nominative definite example in %2$s",
                        "accusativeExample": "simple example using the word \\"%1$s\\" in singular accusative definite case",
                        "accusativeTranslation": "translation of the singular accusative definite example in %2$s",
                        "dativeExample": "simple example using the word \\"%1$s\\" in singular dative definite case",
                        "dativeTranslation": "translation of the singular dative definite example in %2$s",
                        "genitiveExample": "simple example using the word \\"%1$s\\" in singular genitive definite case",
                        "genitiveTranslation": "translation of the singular genitive definite example in %2$s"
                      },
                      "indefinite": {
                        "nominativeExample": "simple example using the word \\"%1$s\\" in singular nominative indefinite case",
                        "nominativeTranslation": "translation of the singular nominative indefinite example in %2$s",
                        "accusativeExample": "simple example using the word \\"%1$s\\" in singular accusative indefinite case",
                        "accusativeTranslation": "translation of the singular accusative indefinite example in %2$s",
                        "dativeExample": "simple example using the word \\"%1$s\\" in singular dative indefinite case",
                        "dativeTranslation": "translation of the singular dative indefinite example in %2$s",
                        "genitiveExample": "simple example using the word \\"%1$s\\" in singular genitive indefinite case",
                        "genitiveTranslation": "translation of the singular genitive indefinite example in %2$s"
                      }
                    },
                    "plural": {
                      "definite": {
                        "nominativeExample": "simple example using the word \\"%1$s\\" in plural nominative definite case",
                        "nominativeTranslation": "translation of the plural nominative definite example in %2$s",
                        "accusativeExample": "simple example using the word \\"%1$s\\" in plural accusative definite case",
                        "accusativeTranslation": "translation of the plural accusative definite example in %2$s",
                        "dativeExample": "simple example using the word \\"%1$s\\" in plural dative definite case",
                        "dativeTranslation": "translation of the plural dative definite example in %2$s",
                        "genitiveExample": "simple example using the word \\"%1$s\\" in plural genitive definite case",
                        "genitiveTranslation": "translation of the plural genitive definite example in %2$s"
                      },
                      "indefinite": {
                        "nominativeExample": "simple example using the word \\"%1$s\\" in plural nominative indefinite case",
                        "nominativeTranslation": "translation of the plural nominative indefinite example in %2$s",
                        "accusativeExample": "simple example using the word \\"%1$s\\" in plural accusative indefinite case",
                        "accusativeTranslation": "translation of the plural accusative indefinite example in %2$s",
                        "dativeExample": "simple example using the word \\"%1$s\\" in plural dative indefinite case",
                        "dativeTranslation": "translation of the plural dative indefinite example in %2$s",
                        "genitiveExample": "simple example using the word \\"%1$s\\" in plural genitive indefinite case",
                        "genitiveTranslation": "translation of the plural genitive indefinite example in %2$s"
                      }
                    }
                  }
                }
              ]
            }

            If the input is not a German noun or contains multiple words that aren't a compound noun, set "error" to true and provide an appropriate error message in %2$s.
            If there are multiple possible interpretations (for example homonyms with different genders), include each as a separate object in the data array.
            Ensure ALL field values are properly escaped for JSON.
            """;

    /**
     * Builds the prompt for the given request.
     *
     * @param request normalized lookup request
     * @return the prompt text
     */
    public String compile(ArticleRequest request) {
        return PROMPT_TEMPLATE.formatted(request.word(), languageName(request.language()));
    }

    /**
     * English display name of a language code, e.g. "de" → "German".
     * Unknown codes are passed through unchanged.
     */
    static String languageName(String languageCode) {
        String name = Locale.forLanguageTag(languageCode).getDisplayLanguage(Locale.ENGLISH);
        return name.isBlank() ? languageCode : name;
    }
}
