package com.mealscout.service;

import reactor.core.publisher.Mono;

public interface ConversationService {

    /**
     * Runs one user turn of a chat against the assistant and returns the reply.
     *
     * <p>Never throws. Failures become a reply starting with {@code Error:}. The user
     * message and the reply are both appended to the chat's message log. Turns of the same
     * chat run one at a time.</p>
     */
    String runTurn(String chatId, String userText, TurnListener listener);

    Mono<String> runTurnAsync(String chatId, String userText, TurnListener listener);
}
