package com.example.accounts.service;

import com.example.accounts.model.ConversationState;
import com.example.accounts.service.util.Msg;
import com.example.accounts.service.util.UserLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Binds the conversation state to the login steps: interprets a user's text by the
 * current state, runs the matching registry step and picks the next state and reply.
 * Replies use fixed message keys only; provider detail goes to the log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationOrchestrator {

    private final ConversationStateMachine stateMachine;
    private final PendingAuthenticationRegistry registry;
    private final SessionStore sessionStore;
    private final UserLocks userLocks;
    private final Msg msg;

    /** Menu entry point: the next text is read as a phone number. */
    public BotReply startPhoneEntry(Long userId, Locale locale) {
        return userLocks.withLock(userId, () -> {
            stateMachine.moveTo(userId, ConversationState.AWAITING_PHONE);
            return BotReply.of(msg.get("auth.phone.prompt", locale));
        });
    }

    /**
     * Handles free text. Empty when the user has no flow in progress.
     *
     * @param notice receives interim messages sent before slow provider calls
     */
    public Optional<BotReply> handleInput(Long userId, String text, Locale locale, Consumer<String> notice) {
        return userLocks.withLock(userId, () -> {
            ConversationState state = stateMachine.current(userId);
            try {
                return switch (state) {
                    case IDLE -> Optional.<BotReply>empty();
                    case AWAITING_PHONE -> Optional.of(onPhone(userId, text, locale, notice));
                    case AWAITING_CODE -> Optional.of(onCode(userId, text, locale));
                    case AWAITING_TWO_FACTOR -> Optional.of(onTwoFactor(userId, text, locale));
                };
            } catch (RuntimeException e) {
                log.error("Login step {} failed for user {}", state, userId, e);
                registry.abandon(userId);
                stateMachine.reset(userId);
                BotReply reply = BotReply.withMenu(msg.get("auth.error.internal", locale));
                return Optional.of(state == ConversationState.AWAITING_PHONE ? reply : reply.deletingInput());
            }
        });
    }

    /** True while the next text is a verification code or a second-factor password. */
    public boolean expectsSecret(Long userId) {
        return userLocks.withLock(userId, () -> {
            ConversationState state = stateMachine.current(userId);
            return state == ConversationState.AWAITING_CODE || state == ConversationState.AWAITING_TWO_FACTOR;
        });
    }

    /** Drops flows idle longer than the TTL. Returns how many users were affected. */
    public int expireStaleFlows(LocalDateTime now) {
        Set<Long> users = new HashSet<>(registry.pendingUserIds());
        users.addAll(stateMachine.trackedUserIds());

        int expired = 0;
        for (Long userId : users) {
            boolean changed = userLocks.withLock(userId, () ->
                    registry.expireIfStale(userId, now) | stateMachine.expireIfStale(userId, now));
            if (changed) {
                expired++;
            }
        }
        return expired;
    }

    private BotReply onPhone(Long userId, String text, Locale locale, Consumer<String> notice) {
        String phone = text.trim();
        if (!stateMachine.isValidPhone(phone)) {
            stateMachine.moveTo(userId, ConversationState.AWAITING_PHONE);
            return BotReply.of(msg.get("auth.phone.invalid", locale));
        }

        Long recordId = sessionStore.insertPhoneNumber(userId, phone);
        notice.accept(msg.get("auth.code.sending", locale));

        AuthOutcome outcome = registry.begin(userId, phone, recordId);
        switch (outcome.status()) {
            case CODE_SENT -> {
                stateMachine.moveTo(userId, ConversationState.AWAITING_CODE);
                return BotReply.of(msg.get("auth.code.sent", locale, HtmlUtils.htmlEscape(phone)));
            }
            case ALREADY_AUTHORIZED -> {
                stateMachine.reset(userId);
                return BotReply.withMenu(msg.get("auth.phone.already-authenticated", locale));
            }
            case INVALID_PHONE -> {
                stateMachine.reset(userId);
                return BotReply.withMenu(msg.get("auth.phone.rejected", locale));
            }
            case RATE_LIMITED -> {
                stateMachine.reset(userId);
                return BotReply.withMenu(msg.get("auth.rate-limited", locale, outcome.waitSeconds()));
            }
            default -> {
                log.warn("Code request for user {} ended with {}", userId, outcome.status());
                stateMachine.reset(userId);
                return BotReply.withMenu(msg.get("auth.error.provider", locale));
            }
        }
    }

    private BotReply onCode(Long userId, String text, Locale locale) {
        AuthOutcome outcome = registry.submitCode(userId, text.trim());
        BotReply reply = switch (outcome.status()) {
            case SUCCESS -> {
                stateMachine.reset(userId);
                yield BotReply.withMenu(msg.get("auth.success", locale));
            }
            case TWO_FACTOR_REQUIRED -> {
                stateMachine.moveTo(userId, ConversationState.AWAITING_TWO_FACTOR);
                yield BotReply.of(msg.get("auth.two-factor.prompt", locale));
            }
            case RETRYABLE -> {
                stateMachine.moveTo(userId, ConversationState.AWAITING_CODE);
                yield BotReply.of(msg.get(outcome.reason() == AuthOutcome.Reason.CODE_EXPIRED
                        ? "auth.code.expired"
                        : "auth.code.invalid", locale));
            }
            case NO_PENDING -> {
                stateMachine.reset(userId);
                yield BotReply.withMenu(msg.get("auth.no-pending", locale));
            }
            default -> {
                registry.abandon(userId);
                stateMachine.reset(userId);
                yield BotReply.withMenu(msg.get("auth.error.provider", locale));
            }
        };
        return reply.deletingInput();
    }

    private BotReply onTwoFactor(Long userId, String password, Locale locale) {
        AuthOutcome outcome = registry.submitTwoFactor(userId, password);
        stateMachine.reset(userId);

        String key = switch (outcome.status()) {
            case SUCCESS -> "auth.two-factor.success";
            case NO_PENDING -> "auth.no-pending";
            default -> outcome.reason() == AuthOutcome.Reason.PASSWORD_INVALID
                    ? "auth.two-factor.invalid"
                    : "auth.error.provider";
        };
        return BotReply.withMenu(msg.get(key, locale)).deletingInput();
    }
}
