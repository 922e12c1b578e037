package com.example.accounts.service.util;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-user mutual exclusion around login flow state. Updates arrive on the polling
 * thread while the expiry sweep runs on the scheduler thread.
 * A user's lock exists only while some thread holds or waits for it.
 */
@Component
public class UserLocks {

    private final Map<Long, Holder> locks = new ConcurrentHashMap<>();

    public <T> T withLock(Long userId, Supplier<T> action) {
        Holder holder = locks.compute(userId, (id, current) -> {
            Holder h = current != null ? current : new Holder();
            h.users++;
            return h;
        });

        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(userId, (id, current) -> --current.users == 0 ? null : current);
        }
    }

    int trackedUsers() {
        return locks.size();
    }

    // users is only touched inside compute calls for the same key
    private static final class Holder {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
