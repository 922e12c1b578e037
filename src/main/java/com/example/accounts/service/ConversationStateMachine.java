package com.example.accounts.service;

import com.example.accounts.config.BotConfig;
import com.example.accounts.model.ConversationState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which input each user is expected to send next. Users without an entry are
 * {@link ConversationState#IDLE}; entries idle longer than the flow TTL are dropped.
 */
@Component
@RequiredArgsConstructor
public class ConversationStateMachine {

    private final BotConfig config;

    private final Map<Long, Entry> states = new ConcurrentHashMap<>();

    public ConversationState current(Long userId) {
        Entry entry = states.get(userId);
        if (entry == null) {
            return ConversationState.IDLE;
        }
        if (entry.isExpired(LocalDateTime.now(), config.getFlowTtlMinutes())) {
            states.remove(userId);
            return ConversationState.IDLE;
        }
        return entry.state();
    }

    public void moveTo(Long userId, ConversationState state) {
        if (state == ConversationState.IDLE) {
            states.remove(userId);
            return;
        }
        states.put(userId, new Entry(state, LocalDateTime.now()));
    }

    public void reset(Long userId) {
        states.remove(userId);
    }

    /** International format: leading plus sign and at least the configured length. */
    public boolean isValidPhone(String text) {
        return text != null
                && text.startsWith("+")
                && text.length() >= config.getPhoneMinLength();
    }

    public boolean expireIfStale(Long userId, LocalDateTime now) {
        Entry entry = states.get(userId);
        if (entry == null || !entry.isExpired(now, config.getFlowTtlMinutes())) {
            return false;
        }
        states.remove(userId);
        return true;
    }

    public Set<Long> trackedUserIds() {
        return Set.copyOf(states.keySet());
    }

    private record Entry(ConversationState state, LocalDateTime lastActivity) {
        boolean isExpired(LocalDateTime now, long ttlMinutes) {
            return lastActivity.plusMinutes(ttlMinutes).isBefore(now);
        }
    }
}
