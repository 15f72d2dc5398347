package com.example.germanarticles.service;

import com.example.germanarticles.model.ArticleInfo;
import com.example.germanarticles.model.ArticleResponse;
import com.example.germanarticles.model.CaseExample;
import com.example.germanarticles.model.ExampleInfo;
import com.example.germanarticles.model.GrammaticalCase;
import com.example.germanarticles.model.TranslationsInfo;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders an {@link ArticleResponse} as a Telegram message in HTML parse mode.
 * <p>
 * Layout per interpretation: the noun with its article and its translation, then one
 * block per grammatical number that has examples. Inside a block the cases follow
 * declension order; each case lists the definite line before the indefinite one, and
 * cases are separated by a blank line. Text coming from the model is HTML-escaped.
 */
@Component
public class ChatMessageFormatter {

    static final String NO_INFORMATION = "❌ No information found for this word.";
    static final String DIVIDER = "\n\n" + "─".repeat(10) + "\n\n";

    public String format(ArticleResponse response) {
        if (!response.success()) {
            return "❌ <b>Error:</b> " + escape(response.error());
        }
        if (response.data().isEmpty()) {
            return NO_INFORMATION;
        }

        List<String> entries = new ArrayList<>();
        for (ArticleInfo info : response.data()) {
            entries.add(formatEntry(info));
        }
        return String.join(DIVIDER, entries);
    }

    private String formatEntry(ArticleInfo info) {
        List<String> blocks = new ArrayList<>();
        blocks.add("🇩🇪 <b>" + escape(info.wordWithArticle()) + "</b>\n"
                + "📖 <i>" + escape(info.translation()) + "</i>");

        ExampleInfo singular = info.example().singular();
        if (singular.isPopulated()) {
            blocks.add("📝 <b>Singular Examples:</b>\n" + formatNumber(singular));
        }
        ExampleInfo plural = info.example().plural();
        if (plural.isPopulated()) {
            blocks.add("📝 <b>Plural Examples:</b>\n" + formatNumber(plural));
        }
        return String.join("\n\n", blocks);
    }

    private String formatNumber(ExampleInfo info) {
        List<String> groups = new ArrayList<>();
        for (GrammaticalCase grammaticalCase : GrammaticalCase.values()) {
            List<String> lines = new ArrayList<>(2);
            addLine(lines, grammaticalCase, "Definite", info.definite());
            addLine(lines, grammaticalCase, "Indefinite", info.indefinite());
            if (!lines.isEmpty()) {
                groups.add(String.join("\n", lines));
            }
        }
        return String.join("\n\n", groups);
    }

    private void addLine(List<String> lines, GrammaticalCase grammaticalCase, String article,
                         TranslationsInfo translations) {
        CaseExample example = translations.get(grammaticalCase);
        if (!example.isPresent()) {
            return;
        }
        lines.add("• <b>" + grammaticalCase.label() + " " + article + ":</b> "
                + escape(example.example()) + " / <i>" + escape(example.translation()) + "</i>");
    }

    private static String escape(String text) {
        return HtmlUtils.htmlEscape(text, "UTF-8");
    }
}
