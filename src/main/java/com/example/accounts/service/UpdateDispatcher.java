package com.example.accounts.service;

import com.example.accounts.model.PhoneNumber;
import com.example.accounts.service.util.MessageCleaner;
import com.example.accounts.service.util.Msg;
import lombok.RequiredArgsConstructor;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboard;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.bots.AbsSender;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.example.accounts.service.util.KeyboardUtil.btn;
import static com.example.accounts.service.util.KeyboardUtil.replyColumn;
import static com.example.accounts.service.util.KeyboardUtil.rows;

/**
 * Routes one update: menu commands and callbacks are handled here, any other text goes
 * to the {@link AuthenticationOrchestrator}. Only private chats are served.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UpdateDispatcher {

    public static final String ADD_NUMBER = "➕ Add Number";
    public static final String MY_NUMBERS = "📱 My Numbers";
    public static final String HELP = "ℹ️ Help";
    private static final Set<String> MENU_BUTTONS = Set.of(ADD_NUMBER, MY_NUMBERS, HELP);

    static final String CB_BACK_MAIN = "back_main";
    static final String CB_BACK_NUMBERS = "back_numbers";
    static final String CB_NUMBER_PREFIX = "number_";
    static final String CB_NONE = "none";

    private static final String PRIVATE_CHAT = "private";
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");
    private static final int NOTICE_TTL_SECONDS = 15;

    private final AuthenticationOrchestrator orchestrator;
    private final SessionStore sessionStore;
    private final MessageCleaner cleaner;
    private final Msg msg;

    /** Never throws: a failing update is logged and the loop moves on. */
    public void dispatch(AbsSender bot, Update update) {
        try {
            if (update.hasMessage() && update.getMessage().hasText()) {
                handleMessage(bot, update.getMessage());
                return;
            }
            if (update.hasCallbackQuery()) {
                handleCallback(bot, update.getCallbackQuery());
            }
        } catch (Exception e) {
            log.error("Failed to process update {}: {}", update.getUpdateId(), e.getMessage(), e);
        }
    }

    // ============================================================
    // Text messages
    // ============================================================
    private void handleMessage(AbsSender bot, Message message) {
        if (!PRIVATE_CHAT.equals(message.getChat().getType())) {
            return;
        }

        User from = message.getFrom();
        Long chatId = message.getChatId();
        Locale locale = Msg.localeOf(from.getLanguageCode());
        String text = message.getText().trim();

        sessionStore.upsertUser(from.getId(), from.getUserName(), from.getFirstName(), from.getLastName());

        // a code or password may look like a command; only the exact menu buttons still navigate
        boolean secretExpected = orchestrator.expectsSecret(from.getId());
        if (secretExpected && !MENU_BUTTONS.contains(text)) {
            handleFlowInput(bot, message, locale);
            return;
        }
        if (secretExpected) {
            cleaner.deleteNow(bot, chatId, message.getMessageId());
        }

        if (text.startsWith("/start")) {
            String name = from.getFirstName() != null ? from.getFirstName() : "User";
            send(bot, chatId, msg.get("menu.welcome", locale, HtmlUtils.htmlEscape(name)), mainMenu());
            return;
        }
        if (text.startsWith("/help") || HELP.equals(text)) {
            send(bot, chatId, msg.get("menu.help", locale), null);
            return;
        }
        if (ADD_NUMBER.equals(text)) {
            BotReply reply = orchestrator.startPhoneEntry(from.getId(), locale);
            send(bot, chatId, reply.text(), null);
            return;
        }
        if (MY_NUMBERS.equals(text)) {
            send(bot, chatId, msg.get("numbers.title", locale), numbersKeyboard(from.getId(), locale));
            return;
        }

        handleFlowInput(bot, message, locale);
    }

    private void handleFlowInput(AbsSender bot, Message message, Locale locale) {
        Long chatId = message.getChatId();
        Optional<BotReply> reply = orchestrator.handleInput(message.getFrom().getId(), message.getText(), locale,
                notice -> sendNotice(bot, chatId, notice));
        if (reply.isEmpty()) {
            return;
        }

        BotReply r = reply.get();
        send(bot, chatId, r.text(), r.showMainMenu() ? mainMenu() : null);
        if (r.deleteInput()) {
            cleaner.deleteNow(bot, chatId, message.getMessageId());
        }
    }

    // ============================================================
    // Inline keyboard callbacks
    // ============================================================
    private void handleCallback(AbsSender bot, CallbackQuery cbq) {
        Message source = cbq.getMessage();
        answer(bot, cbq.getId());
        if (source == null || !PRIVATE_CHAT.equals(source.getChat().getType())) {
            return;
        }

        String data = cbq.getData() == null ? "" : cbq.getData();
        Long userId = cbq.getFrom().getId();
        Long chatId = source.getChatId();
        Integer messageId = source.getMessageId();
        Locale locale = Msg.localeOf(cbq.getFrom().getLanguageCode());

        if (CB_BACK_MAIN.equals(data)) {
            edit(bot, chatId, messageId, msg.get("menu.main", locale), null);
            return;
        }
        if (CB_BACK_NUMBERS.equals(data)) {
            edit(bot, chatId, messageId, msg.get("numbers.title", locale), numbersKeyboard(userId, locale));
            return;
        }
        if (data.startsWith(CB_NUMBER_PREFIX)) {
            showNumberDetails(bot, chatId, messageId, userId, data.substring(CB_NUMBER_PREFIX.length()), locale);
            return;
        }
        if (!CB_NONE.equals(data)) {
            log.debug("Unknown callback payload '{}' from user {}", data, userId);
        }
    }

    private void showNumberDetails(AbsSender bot, Long chatId, Integer messageId, Long userId, String rawId,
                                   Locale locale) {
        InlineKeyboardMarkup back = rows(List.of(List.of(btn(msg.get("button.back", locale), CB_BACK_NUMBERS))));

        Optional<PhoneNumber> number;
        try {
            number = sessionStore.findPhoneNumber(userId, Long.parseLong(rawId));
        } catch (NumberFormatException e) {
            number = Optional.empty();
        }

        if (number.isEmpty()) {
            edit(bot, chatId, messageId, msg.get("numbers.not-found", locale), back);
            return;
        }

        PhoneNumber n = number.get();
        String text = msg.get("numbers.details", locale,
                n.getId(),
                HtmlUtils.htmlEscape(n.getPhoneNumber()),
                n.getStatus().label(),
                format(n.getAddedAt()),
                format(n.getLastLogin()));
        edit(bot, chatId, messageId, text, back);
    }

    private InlineKeyboardMarkup numbersKeyboard(Long userId, Locale locale) {
        List<PhoneNumber> numbers = sessionStore.listPhoneNumbers(userId);
        if (numbers.isEmpty()) {
            return rows(List.of(List.of(btn(msg.get("numbers.empty", locale), CB_NONE))));
        }

        List<List<InlineKeyboardButton>> keyboard = new ArrayList<>();
        for (PhoneNumber n : numbers) {
            String mark = n.isAuthenticated() ? "✅" : "⏳";
            String label = "%s %s (%s)".formatted(mark, n.getPhoneNumber(), n.getStatus().label());
            keyboard.add(List.of(btn(label, CB_NUMBER_PREFIX + n.getId())));
        }
        keyboard.add(List.of(btn(msg.get("button.back", locale), CB_BACK_MAIN)));
        return rows(keyboard);
    }

    private ReplyKeyboard mainMenu() {
        return replyColumn(ADD_NUMBER, MY_NUMBERS, HELP);
    }

    private String format(LocalDateTime time) {
        return time != null ? time.format(DATE_TIME) : "—";
    }

    // ============================================================
    // Outbound calls
    // ============================================================
    @SneakyThrows
    private Message send(AbsSender bot, Long chatId, String text, ReplyKeyboard keyboard) {
        SendMessage message = new SendMessage(chatId.toString(), text);
        message.setParseMode(ParseMode.HTML);
        if (keyboard != null) {
            message.setReplyMarkup(keyboard);
        }
        return bot.execute(message);
    }

    private void sendNotice(AbsSender bot, Long chatId, String text) {
        Message notice = send(bot, chatId, text, null);
        if (notice != null) {
            cleaner.deleteLater(bot, chatId, notice.getMessageId(), NOTICE_TTL_SECONDS);
        }
    }

    @SneakyThrows
    private void edit(AbsSender bot, Long chatId, Integer messageId, String text, InlineKeyboardMarkup keyboard) {
        EditMessageText edit = new EditMessageText();
        edit.setChatId(chatId.toString());
        edit.setMessageId(messageId);
        edit.setText(text);
        edit.setParseMode(ParseMode.HTML);
        if (keyboard != null) {
            edit.setReplyMarkup(keyboard);
        }
        bot.execute(edit);
    }

    private void answer(AbsSender bot, String callbackId) {
        try {
            bot.execute(AnswerCallbackQuery.builder()
                    .callbackQueryId(callbackId)
                    .build());
        } catch (Exception e) {
            log.warn("Failed to answer callback {}: {}", callbackId, e.getMessage());
        }
    }
}
