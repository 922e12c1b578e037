package com.example.accounts;

import com.example.accounts.config.BotConfig;

public final class TestBotConfigs {

    private TestBotConfigs() {}

    public static BotConfig defaults() {
        BotConfig config = new BotConfig();
        config.setBotName("test_bot");
        config.setToken("123:abc");
        config.setUpdatesTimeoutSeconds(30);
        config.setGatewayUrl("http://gateway.test");
        config.setApiId("1");
        config.setApiHash("hash");
        config.setSessionPrefix("sessions/session_");
        config.setPhoneMinLength(10);
        config.setFlowTtlMinutes(10);
        return config;
    }
}
