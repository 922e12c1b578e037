package com.example.accounts.controllers.impl;

import com.example.accounts.service.exception.AccountClientException;
import com.example.accounts.service.exception.FloodWaitException;
import com.example.accounts.service.exception.PasswordInvalidException;
import com.example.accounts.service.exception.PhoneCodeExpiredException;
import com.example.accounts.service.exception.PhoneCodeInvalidException;
import com.example.accounts.service.exception.PhoneNumberInvalidException;
import com.example.accounts.service.exception.SessionPasswordNeededException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Locale;

/**
 * Turns gateway failures into the account client exception hierarchy. The gateway
 * answers errors with a body like {@code {"error":"PHONE_CODE_INVALID"}} using the
 * provider's RPC error names.
 */
public final class GatewayErrorMapper {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String FLOOD_WAIT_PREFIX = "FLOOD_WAIT_";

    private GatewayErrorMapper() {}

    public static AccountClientException map(String operation, RestClientException e) {
        if (!(e instanceof RestClientResponseException re)) {
            return new AccountClientException(operation + " failed: " + e.getMessage(), e);
        }

        String code = errorCode(re.getResponseBodyAsString());
        String detail = operation + " rejected with " + re.getStatusCode().value() + " " + code;

        if (code.startsWith(FLOOD_WAIT_PREFIX)) {
            return new FloodWaitException(parseSeconds(code.substring(FLOOD_WAIT_PREFIX.length())));
        }

        AccountClientException known = switch (code) {
            case "PHONE_NUMBER_INVALID", "PHONE_NUMBER_BANNED" -> new PhoneNumberInvalidException(detail);
            case "PHONE_CODE_INVALID", "PHONE_CODE_EMPTY" -> new PhoneCodeInvalidException(detail);
            case "PHONE_CODE_EXPIRED" -> new PhoneCodeExpiredException(detail);
            case "SESSION_PASSWORD_NEEDED" -> new SessionPasswordNeededException(detail);
            case "PASSWORD_HASH_INVALID" -> new PasswordInvalidException(detail);
            default -> null;
        };
        if (known != null) {
            return known;
        }

        if (re.getStatusCode().value() == 429) {
            return new FloodWaitException(retryAfter(re.getResponseHeaders()));
        }
        return new AccountClientException(detail, e);
    }

    static String errorCode(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = JSON.readTree(body);
            JsonNode error = node.get("error");
            if (error != null && error.isTextual()) {
                return error.asText().trim().toUpperCase(Locale.ROOT);
            }
        } catch (JsonProcessingException e) {
            // plain-text body
            return body.trim().toUpperCase(Locale.ROOT);
        }
        return "";
    }

    private static long retryAfter(HttpHeaders headers) {
        if (headers == null) {
            return 0;
        }
        return parseSeconds(headers.getFirst(HttpHeaders.RETRY_AFTER));
    }

    private static long parseSeconds(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
