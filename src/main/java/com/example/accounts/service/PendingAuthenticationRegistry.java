package com.example.accounts.service;

import com.example.accounts.config.BotConfig;
import com.example.accounts.controllers.AccountClient;
import com.example.accounts.controllers.AccountClientFactory;
import com.example.accounts.dto.AccountIdentity;
import com.example.accounts.model.PhoneNumber;
import com.example.accounts.model.PhoneNumberStatus;
import com.example.accounts.service.exception.AccountClientException;
import com.example.accounts.service.exception.FloodWaitException;
import com.example.accounts.service.exception.PasswordInvalidException;
import com.example.accounts.service.exception.PhoneCodeExpiredException;
import com.example.accounts.service.exception.PhoneCodeInvalidException;
import com.example.accounts.service.exception.PhoneNumberInvalidException;
import com.example.accounts.service.exception.SessionPasswordNeededException;
import com.example.accounts.service.util.SessionNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps at most one in-flight login per user and drives it through
 * code request, code sign-in and second-factor sign-in.
 * Callers serialize access per user (see {@link com.example.accounts.service.util.UserLocks}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PendingAuthenticationRegistry {

    private final AccountClientFactory clientFactory;
    private final SessionStore sessionStore;
    private final SessionNames sessionNames;
    private final BotConfig config;

    private final Map<Long, PendingAuthentication> storage = new ConcurrentHashMap<>();

    /**
     * Requests a one-time code for the phone number. A login already pending for the
     * user is closed and marked failed first.
     */
    public AuthOutcome begin(Long userId, String phoneNumber, Long phoneRecordId) {
        abandon(userId);

        String sessionRef = sessionNames.sessionRef(userId, phoneNumber);
        AccountClient client = null;
        try {
            client = clientFactory.connect(sessionRef);

            if (client.isAuthorized()) {
                client.disconnect();
                persistSession(userId, phoneNumber, phoneRecordId, sessionRef);
                log.info("Session for user {} record {} is already authorized", userId, phoneRecordId);
                return AuthOutcome.alreadyAuthorized();
            }

            String codeToken = client.requestCode(phoneNumber);
            LocalDateTime now = LocalDateTime.now();
            storage.put(userId, PendingAuthentication.builder()
                    .userId(userId)
                    .phoneNumber(phoneNumber)
                    .phoneRecordId(phoneRecordId)
                    .sessionRef(sessionRef)
                    .client(client)
                    .codeToken(codeToken)
                    .createdAt(now)
                    .lastActivity(now)
                    .build());

            log.info("Code requested for user {} record {}", userId, phoneRecordId);
            return AuthOutcome.codeSent();
        } catch (PhoneNumberInvalidException e) {
            log.warn("Phone number rejected for user {}: {}", userId, e.getMessage());
            abort(client, phoneRecordId);
            return AuthOutcome.invalidPhone(e.getMessage());
        } catch (FloodWaitException e) {
            log.warn("Code request rate limited for user {}: wait {}s", userId, e.getSeconds());
            abort(client, phoneRecordId);
            return AuthOutcome.rateLimited(e.getSeconds());
        } catch (AccountClientException e) {
            log.error("Code request failed for user {}: {}", userId, e.getMessage());
            abort(client, phoneRecordId);
            return AuthOutcome.failed(AuthOutcome.Reason.PROVIDER_ERROR, e.getMessage());
        }
    }

    /**
     * Signs in with the received code. The pending login survives everything except success.
     */
    public AuthOutcome submitCode(Long userId, String code) {
        Optional<PendingAuthentication> found = find(userId);
        if (found.isEmpty()) {
            return AuthOutcome.noPending();
        }

        PendingAuthentication pending = found.get();
        pending.setLastActivity(LocalDateTime.now());
        try {
            AccountIdentity identity = pending.getClient()
                    .signInWithCode(pending.getPhoneNumber(), code, pending.getCodeToken());
            complete(pending, identity);
            return AuthOutcome.success();
        } catch (SessionPasswordNeededException e) {
            log.info("Second factor required for user {} record {}", userId, pending.getPhoneRecordId());
            return AuthOutcome.twoFactorRequired();
        } catch (PhoneCodeInvalidException e) {
            log.info("Invalid code from user {}", userId);
            return AuthOutcome.retryable(AuthOutcome.Reason.CODE_INVALID);
        } catch (PhoneCodeExpiredException e) {
            log.info("Expired code from user {}", userId);
            return AuthOutcome.retryable(AuthOutcome.Reason.CODE_EXPIRED);
        } catch (AccountClientException e) {
            log.error("Code sign-in failed for user {}: {}", userId, e.getMessage());
            return AuthOutcome.failed(AuthOutcome.Reason.PROVIDER_ERROR, e.getMessage());
        }
    }

    /**
     * Signs in with the second-factor password. Any failure ends the pending login.
     */
    public AuthOutcome submitTwoFactor(Long userId, String password) {
        Optional<PendingAuthentication> found = find(userId);
        if (found.isEmpty()) {
            return AuthOutcome.noPending();
        }

        PendingAuthentication pending = found.get();
        pending.setLastActivity(LocalDateTime.now());
        try {
            AccountIdentity identity = pending.getClient().signInWithPassword(password);
            complete(pending, identity);
            return AuthOutcome.success();
        } catch (PasswordInvalidException e) {
            log.info("Invalid second-factor password from user {}", userId);
            abandon(userId);
            return AuthOutcome.failed(AuthOutcome.Reason.PASSWORD_INVALID, e.getMessage());
        } catch (AccountClientException e) {
            log.error("Second-factor sign-in failed for user {}: {}", userId, e.getMessage());
            abandon(userId);
            return AuthOutcome.failed(AuthOutcome.Reason.PROVIDER_ERROR, e.getMessage());
        }
    }

    public Optional<PendingAuthentication> find(Long userId) {
        PendingAuthentication pending = storage.get(userId);
        if (pending == null) {
            return Optional.empty();
        }
        if (pending.isExpired(LocalDateTime.now(), config.getFlowTtlMinutes())) {
            abandon(userId);
            return Optional.empty();
        }
        return Optional.of(pending);
    }

    /** Drops the pending login, closes its connection and marks its phone record failed. */
    public void abandon(Long userId) {
        PendingAuthentication removed = storage.remove(userId);
        if (removed != null) {
            log.debug("Pending login of user {} record {} abandoned", userId, removed.getPhoneRecordId());
            abort(removed.getClient(), removed.getPhoneRecordId());
        }
    }

    public boolean expireIfStale(Long userId, LocalDateTime now) {
        PendingAuthentication pending = storage.get(userId);
        if (pending == null || !pending.isExpired(now, config.getFlowTtlMinutes())) {
            return false;
        }
        abandon(userId);
        log.info("Pending login of user {} expired", userId);
        return true;
    }

    public Set<Long> pendingUserIds() {
        return Set.copyOf(storage.keySet());
    }

    private void complete(PendingAuthentication pending, AccountIdentity identity) {
        try {
            persistSession(pending.getUserId(), pending.getPhoneNumber(), pending.getPhoneRecordId(),
                    pending.getSessionRef());
        } finally {
            storage.remove(pending.getUserId());
            pending.getClient().disconnect();
        }
        log.info("User {} signed in record {} as account {}", pending.getUserId(), pending.getPhoneRecordId(),
                identity != null ? identity.getId() : null);
    }

    private void persistSession(Long userId, String phoneNumber, Long phoneRecordId, String sessionRef) {
        sessionStore.upsertSession(userId, phoneNumber, sessionRef);
        Long recordId = resolveRecordId(userId, phoneNumber, phoneRecordId);
        if (recordId != null) {
            sessionStore.updatePhoneStatus(recordId, PhoneNumberStatus.AUTHENTICATED, true);
        }
    }

    private void abort(AccountClient client, Long phoneRecordId) {
        if (client != null) {
            client.disconnect();
        }
        if (phoneRecordId != null) {
            sessionStore.updatePhoneStatus(phoneRecordId, PhoneNumberStatus.FAILED, false);
        }
    }

    private Long resolveRecordId(Long userId, String phoneNumber, Long phoneRecordId) {
        if (phoneRecordId != null) {
            return phoneRecordId;
        }
        return sessionStore.findLatestPhoneNumber(userId, phoneNumber)
                .map(PhoneNumber::getId)
                .orElse(null);
    }
}
