package com.example.accounts.service;

/**
 * What the bot answers to one piece of user input.
 *
 * @param showMainMenu attach the main reply keyboard
 * @param deleteInput  the input carried a secret and should be removed from the chat
 */
public record BotReply(String text, boolean showMainMenu, boolean deleteInput) {

    public static BotReply of(String text) {
        return new BotReply(text, false, false);
    }

    public static BotReply withMenu(String text) {
        return new BotReply(text, true, false);
    }

    public BotReply deletingInput() {
        return new BotReply(text, showMainMenu, true);
    }
}
