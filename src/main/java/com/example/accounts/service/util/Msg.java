package com.example.accounts.service.util;

import lombok.RequiredArgsConstructor;
import org.springframework.context.MessageSource;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class Msg {
    private final MessageSource messageSource;

    public String get(String key, Locale locale, Object... args) {
        return messageSource.getMessage(key, args, locale);
    }

    /** Locale for a Telegram language code such as {@code "en"} or {@code "pt-br"}. */
    public static Locale localeOf(String languageCode) {
        if (languageCode == null || languageCode.isBlank()) {
            return Locale.ENGLISH;
        }
        return Locale.forLanguageTag(languageCode);
    }
}
