package com.mealscout.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Live connections and the chat each one is currently in.
 *
 * <p>A connection belongs to at most one chat. Both maps are guarded by one read/write
 * lock, so a connection is in a chat's member set exactly when that chat is its current chat.</p>
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, String> currentChat = new HashMap<>();
    private final Set<String> connections = new LinkedHashSet<>();
    private final Map<String, Set<String>> members = new HashMap<>();

    public void register(String connectionId) {
        lock.writeLock().lock();
        try {
            if (connections.add(connectionId)) {
                log.debug("Registered connectionId={}", connectionId);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void unregister(String connectionId) {
        lock.writeLock().lock();
        try {
            connections.remove(connectionId);
            String chatId = currentChat.remove(connectionId);
            if (chatId != null) {
                leave(connectionId, chatId);
            }
            log.debug("Unregistered connectionId={} lastChatId={}", connectionId, chatId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Makes {@code chatId} the connection's current chat.
     *
     * @return false when the connection is not registered (or already gone); nothing changes then
     */
    public boolean joinChat(String connectionId, String chatId) {
        lock.writeLock().lock();
        try {
            if (!connections.contains(connectionId)) {
                log.debug("Ignoring join of unregistered connectionId={} chatId={}", connectionId, chatId);
                return false;
            }
            String previous = currentChat.put(connectionId, chatId);
            if (chatId.equals(previous)) {
                return true;
            }
            if (previous != null) {
                leave(connectionId, previous);
            }
            members.computeIfAbsent(chatId, id -> new LinkedHashSet<>()).add(connectionId);
            log.debug("connectionId={} joined chatId={} (left {})", connectionId, chatId, previous);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Set<String> membersOf(String chatId) {
        lock.readLock().lock();
        try {
            Set<String> current = members.get(chatId);
            return current == null ? Set.of() : Set.copyOf(current);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<String> chatOf(String connectionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(currentChat.get(connectionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(String connectionId) {
        lock.readLock().lock();
        try {
            return connections.contains(connectionId);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void leave(String connectionId, String chatId) {
        Set<String> current = members.get(chatId);
        if (current == null) {
            return;
        }
        current.remove(connectionId);
        if (current.isEmpty()) {
            members.remove(chatId);
        }
    }
}
