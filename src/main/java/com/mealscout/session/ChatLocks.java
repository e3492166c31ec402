package com.mealscout.session;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Striped locks keyed by chat id. Two chats may share a stripe; one chat always maps to the same one.
 */
@Component
public class ChatLocks {

    private static final int STRIPES = 128;

    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];

    public ChatLocks() {
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    public ReentrantLock of(String chatId) {
        int idx = Math.abs(Objects.hashCode(chatId)) & (stripes.length - 1);
        return stripes[idx];
    }
}
