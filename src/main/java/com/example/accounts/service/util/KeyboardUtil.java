package com.example.accounts.service.util;

import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.ReplyKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.KeyboardRow;

import java.util.ArrayList;
import java.util.List;

public final class KeyboardUtil {
    private KeyboardUtil() {}

    public static InlineKeyboardButton btn(String text, String data) {
        InlineKeyboardButton b = new InlineKeyboardButton(text);
        b.setCallbackData(data);
        return b;
    }

    public static InlineKeyboardMarkup rows(List<List<InlineKeyboardButton>> rows) {
        InlineKeyboardMarkup mk = new InlineKeyboardMarkup();
        mk.setKeyboard(rows);
        return mk;
    }

    /** Reply keyboard with one button per row. */
    public static ReplyKeyboardMarkup replyColumn(String... labels) {
        List<KeyboardRow> keyboard = new ArrayList<>();
        for (String label : labels) {
            KeyboardRow row = new KeyboardRow();
            row.add(label);
            keyboard.add(row);
        }
        ReplyKeyboardMarkup mk = new ReplyKeyboardMarkup();
        mk.setKeyboard(keyboard);
        mk.setResizeKeyboard(true);
        return mk;
    }
}
