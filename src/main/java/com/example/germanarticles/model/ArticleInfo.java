package com.example.germanarticles.model;

/**
 * One interpretation of a German noun.
 *
 * @param wordWithArticle the noun with its article, e.g. "das Haus"
 * @param translation     translation into the reader's language
 * @param example         usage examples per grammatical number
 */
public record ArticleInfo(
        String wordWithArticle,
        String translation,
        ExamplesInfo example
) {

    public ArticleInfo {
        wordWithArticle = wordWithArticle == null ? "" : wordWithArticle;
        translation = translation == null ? "" : translation;
        example = example == null ? ExamplesInfo.EMPTY : example;
    }
}
