package org.lime.caddie.conversation;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory sessions keyed by user. Turns for the same user run one at a time; different users never block each other.
 */
@Component
public class DialogueSessionStore {

    private final Map<String, DialogueSession> sessions = new ConcurrentHashMap<>();

    public <T> T withSession(String userId, Function<DialogueSession, T> work) {
        while (true) {
            DialogueSession session = sessions.computeIfAbsent(userId, DialogueSession::new);
            ReentrantLock lock = session.turnLock();
            lock.lock();
            try {
                // evicted while we waited for the lock
                if (sessions.get(userId) != session) {
                    continue;
                }
                return work.apply(session);
            } finally {
                lock.unlock();
            }
        }
    }

    public <T> Optional<T> withExistingSession(String userId, Function<DialogueSession, T> work) {
        DialogueSession session = sessions.get(userId);
        if (session == null) {
            return Optional.empty();
        }
        ReentrantLock lock = session.turnLock();
        lock.lock();
        try {
            if (sessions.get(userId) != session) {
                return Optional.empty();
            }
            return Optional.ofNullable(work.apply(session));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the user's running turn, if any, before dropping the session.
     */
    public boolean evict(String userId) {
        DialogueSession session = sessions.get(userId);
        if (session == null) {
            return false;
        }
        ReentrantLock lock = session.turnLock();
        lock.lock();
        try {
            return sessions.remove(userId, session);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return sessions.size();
    }
}
