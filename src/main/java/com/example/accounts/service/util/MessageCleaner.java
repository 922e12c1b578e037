package com.example.accounts.service.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.DeleteMessage;
import org.telegram.telegrambots.meta.bots.AbsSender;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class MessageCleaner {

    public void deleteLater(AbsSender bot, Long chatId, Integer messageId, int seconds) {
        CompletableFuture
                .delayedExecutor(seconds, TimeUnit.SECONDS)
                .execute(() -> deleteNow(bot, chatId, messageId));
    }

    /** Best effort: a message the bot may not delete is logged and left in place. */
    public void deleteNow(AbsSender bot, Long chatId, Integer messageId) {
        if (messageId == null) {
            return;
        }
        try {
            bot.execute(new DeleteMessage(chatId.toString(), messageId));
        } catch (Exception e) {
            log.warn("Failed to delete message chatId={}, msgId={}, err={}",
                    chatId, messageId, e.getMessage());
        }
    }
}
