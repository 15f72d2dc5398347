package com.example.germanarticles.telegram;

import com.example.germanarticles.model.ArticleResponse;
import com.example.germanarticles.service.ArticleResponseFormatter;
import com.example.germanarticles.service.ArticleService;
import com.example.germanarticles.service.Channel;
import com.example.germanarticles.service.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers Telegram messages: {@code /start} gets a welcome text, any other text is
 * looked up as a German noun in the sender's interface language.
 */
public class TelegramBotHandler {

    private static final Logger log = LoggerFactory.getLogger(TelegramBotHandler.class);

    static final String WELCOME_MESSAGE = """
            🇩🇪 Willkommen! Welcome! Добро пожаловать!

            I'm your German Article Bot! Send me any German noun, and I'll help you determine the correct article (der, die, das) along with usage examples.

            Just type a German word and I'll provide:
            • The correct article
            • Translation
            • Examples in different grammatical cases

            Try sending me a word like "Haus" or "Katze"!""";

    static final String EMPTY_TEXT_MESSAGE = "Please send me a German word to analyze.";
    static final String FAILURE_MESSAGE =
            "Sorry, I encountered an error while processing your request. Please try again.";

    private final TelegramBotClient botClient;
    private final ArticleService articleService;
    private final ArticleResponseFormatter formatter;

    public TelegramBotHandler(TelegramBotClient botClient,
                              ArticleService articleService,
                              ArticleResponseFormatter formatter) {
        this.botClient = botClient;
        this.articleService = articleService;
        this.formatter = formatter;
    }

    /**
     * Handles one webhook update. Updates without a text message are ignored.
     */
    public void handle(TelegramUpdate update) {
        TelegramUpdate.Message message = update.message();
        if (message == null || message.chat() == null || message.text() == null) {
            log.debug("Ignoring update {} without a text message", update.updateId());
            return;
        }
        long chatId = message.chat().id();
        String text = message.text().trim();

        if (isStartCommand(text)) {
            botClient.sendMessage(chatId, WELCOME_MESSAGE, null);
            return;
        }
        if (text.isEmpty()) {
            botClient.sendMessage(chatId, EMPTY_TEXT_MESSAGE, null);
            return;
        }

        ArticleResponse response;
        try {
            response = articleService.determineArticle(text, userLanguage(message.from()));
        } catch (GenerationException e) {
            log.error("Lookup of '{}' for chat {} failed", text, chatId, e);
            botClient.sendMessage(chatId, FAILURE_MESSAGE, null);
            return;
        }
        botClient.sendMessage(chatId, formatter.format(response, Channel.CHAT), TelegramBotClient.PARSE_MODE_HTML);
    }

    /** Matches {@code /start}, {@code /start payload} and the group form {@code /start@BotName}. */
    static boolean isStartCommand(String text) {
        String command = text.split("\\s", 2)[0];
        int mention = command.indexOf('@');
        return (mention < 0 ? command : command.substring(0, mention)).equals("/start");
    }

    private static String userLanguage(TelegramUpdate.User user) {
        if (user == null || user.languageCode() == null || user.languageCode().isBlank()) {
            return "en";
        }
        return user.languageCode();
    }
}
