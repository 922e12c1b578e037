package com.example.accounts.service;

import com.example.accounts.controllers.AccountClient;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.LocalDateTime;

/** An in-flight login: a code was requested and the client connection is still open. */
@Data
@Builder
public class PendingAuthentication {
    private Long userId;
    private String phoneNumber;
    private Long phoneRecordId;
    private String sessionRef;

    @ToString.Exclude
    private AccountClient client;

    @ToString.Exclude
    private String codeToken;

    private LocalDateTime createdAt;
    private LocalDateTime lastActivity;

    public boolean isExpired(LocalDateTime now, long ttlMinutes) {
        return lastActivity.plusMinutes(ttlMinutes).isBefore(now);
    }
}
