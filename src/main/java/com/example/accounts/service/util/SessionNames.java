package com.example.accounts.service.util;

import com.example.accounts.config.BotConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the storage slot of a session from the (user, phone number) pair.
 * The same pair always maps to the same reference.
 */
@Component
@RequiredArgsConstructor
public class SessionNames {

    private final BotConfig config;

    public String sessionRef(Long userId, String phoneNumber) {
        return config.getSessionPrefix() + digest(userId + "_" + phoneNumber);
    }

    static String digest(String value) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
