package com.example.germanarticles.console;

import com.example.germanarticles.model.ArticleResponse;
import com.example.germanarticles.service.ArticleResponseFormatter;
import com.example.germanarticles.service.ArticleService;
import com.example.germanarticles.service.Channel;
import com.example.germanarticles.service.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * Single lookup from the command line, for local testing.
 *
 * <p>Usage: {@code java -jar german-articles.jar --spring.profiles.active=console <word> [language]}
 */
@Component
@Profile("console")
public class ConsoleRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRunner.class);

    static final String USAGE = """
            Usage: german-articles --spring.profiles.active=console <word> [language]
            Example: german-articles --spring.profiles.active=console Haus en""";

    private final ArticleService articleService;
    private final ArticleResponseFormatter formatter;
    private final PrintStream out;
    private int exitCode;

    @Autowired
    public ConsoleRunner(ArticleService articleService, ArticleResponseFormatter formatter) {
        this(articleService, formatter, System.out);
    }

    ConsoleRunner(ArticleService articleService, ArticleResponseFormatter formatter, PrintStream out) {
        this.articleService = articleService;
        this.formatter = formatter;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> words = args.getNonOptionArgs();
        if (words.isEmpty()) {
            out.println(USAGE);
            exitCode = 1;
            return;
        }

        String word = words.get(0);
        String language = words.size() > 1 ? words.get(1) : "en";
        try {
            ArticleResponse response = articleService.determineArticle(word, language);
            out.println(formatter.format(response, Channel.CONSOLE));
        } catch (GenerationException e) {
            log.error("Failed to process request for '{}'", word, e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
