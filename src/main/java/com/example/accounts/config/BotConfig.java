package com.example.accounts.config;

import lombok.Data;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Data
public class BotConfig {

    public static final String TOKEN_PLACEHOLDER = "YOUR_BOT_TOKEN_HERE";

    @Value("${bot.name}")
    String botName;

    @Value("${bot.token}")
    String token;

    @Value("${bot.updates.timeout-seconds:30}")
    Integer updatesTimeoutSeconds;

    @Value("${account.gateway.base-url}")
    String gatewayUrl;

    @Value("${account.gateway.api-id:}")
    String apiId;

    @Value("${account.gateway.api-hash:}")
    String apiHash;

    @Value("${account.session.prefix:sessions/session_}")
    String sessionPrefix;

    @Value("${auth.phone.min-length:10}")
    Integer phoneMinLength;

    @Value("${auth.flow.ttl-minutes:10}")
    Integer flowTtlMinutes;

    /** Token and gateway credentials are filled in and not left as placeholders. */
    public boolean isComplete() {
        return token != null && !token.isBlank() && !TOKEN_PLACEHOLDER.equals(token)
                && apiId != null && !apiId.isBlank()
                && apiHash != null && !apiHash.isBlank();
    }
}
