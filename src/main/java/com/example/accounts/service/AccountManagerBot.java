package com.example.accounts.service;

import com.example.accounts.config.BotConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.DefaultBotOptions;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.Update;

import java.util.List;

/**
 * Long-polling entry point. The library fetches batches of updates and hands them over
 * one at a time, in arrival order, on a single thread.
 */
@Slf4j
@Component
public class AccountManagerBot extends TelegramLongPollingBot {

    private final BotConfig config;
    private final UpdateDispatcher dispatcher;

    public AccountManagerBot(BotConfig config, UpdateDispatcher dispatcher) {
        super(botOptions(config), config.getToken());
        this.config = config;
        this.dispatcher = dispatcher;
    }

    private static DefaultBotOptions botOptions(BotConfig config) {
        DefaultBotOptions options = new DefaultBotOptions();
        options.setGetUpdatesTimeout(config.getUpdatesTimeoutSeconds());
        options.setAllowedUpdates(List.of("message", "callback_query"));
        return options;
    }

    @Override
    public String getBotUsername() {
        return config.getBotName();
    }

    @Override
    public void onUpdateReceived(Update update) {
        dispatcher.dispatch(this, update);
    }
}
