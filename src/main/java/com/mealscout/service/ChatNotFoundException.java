package com.mealscout.service;

public class ChatNotFoundException extends RuntimeException {

    private final String chatId;

    public ChatNotFoundException(String chatId) {
        super("Chat not found: " + chatId);
        this.chatId = chatId;
    }

    public String getChatId() {
        return chatId;
    }
}
