package com.example.germanarticles.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.EnumMap;
import java.util.Map;

/**
 * Example sentences for the four grammatical cases with one article kind,
 * each paired with its translation.
 * <p>
 * The flat field layout mirrors the JSON the model is asked to produce.
 * Callers that render examples should go through {@link #get(GrammaticalCase)}
 * or {@link #presentCases()} instead of the individual accessors.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TranslationsInfo(
        String nominativeExample,
        String nominativeTranslation,
        String accusativeExample,
        String accusativeTranslation,
        String dativeExample,
        String dativeTranslation,
        String genitiveExample,
        String genitiveTranslation
) {

    public static final TranslationsInfo EMPTY =
            new TranslationsInfo(null, null, null, null, null, null, null, null);

    public TranslationsInfo {
        nominativeExample = orEmpty(nominativeExample);
        nominativeTranslation = orEmpty(nominativeTranslation);
        accusativeExample = orEmpty(accusativeExample);
        accusativeTranslation = orEmpty(accusativeTranslation);
        dativeExample = orEmpty(dativeExample);
        dativeTranslation = orEmpty(dativeTranslation);
        genitiveExample = orEmpty(genitiveExample);
        genitiveTranslation = orEmpty(genitiveTranslation);
    }

    public CaseExample get(GrammaticalCase grammaticalCase) {
        return switch (grammaticalCase) {
            case NOMINATIVE -> new CaseExample(nominativeExample, nominativeTranslation);
            case ACCUSATIVE -> new CaseExample(accusativeExample, accusativeTranslation);
            case DATIVE -> new CaseExample(dativeExample, dativeTranslation);
            case GENITIVE -> new CaseExample(genitiveExample, genitiveTranslation);
        };
    }

    /**
     * Cases that have both an example and a translation, in declension order.
     * A case with only one half filled in is left out.
     */
    public Map<GrammaticalCase, CaseExample> presentCases() {
        Map<GrammaticalCase, CaseExample> present = new EnumMap<>(GrammaticalCase.class);
        for (GrammaticalCase grammaticalCase : GrammaticalCase.values()) {
            CaseExample example = get(grammaticalCase);
            if (example.isPresent()) {
                present.put(grammaticalCase, example);
            }
        }
        return present;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
