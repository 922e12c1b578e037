package com.example.accounts.config;

import com.example.accounts.service.AccountManagerBot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

@Slf4j
@Component
@RequiredArgsConstructor
public class BotInitializer {

    private final BotConfig config;
    private final AccountManagerBot bot;

    @EventListener(ContextRefreshedEvent.class)
    public void init() {
        if (!config.isComplete()) {
            log.error("Bot is not registered: set bot.token, account.gateway.api-id and account.gateway.api-hash");
            return;
        }
        try {
            TelegramBotsApi api = new TelegramBotsApi(DefaultBotSession.class);
            api.registerBot(bot);
            log.info("Bot '{}' is polling for updates", config.getBotName());
        } catch (TelegramApiException e) {
            log.error("Failed to register bot '{}': {}", config.getBotName(), e.getMessage());
        }
    }
}
