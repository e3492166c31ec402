package com.mealscout.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.mealscout.assistant.AssistantBootstrap;
import com.mealscout.assistant.AssistantClient;
import com.mealscout.assistant.dto.PendingToolCall;
import com.mealscout.assistant.dto.RunSnapshot;
import com.mealscout.assistant.dto.ThreadMessage;
import com.mealscout.assistant.dto.ToolOutput;
import com.mealscout.config.AiProperties;
import com.mealscout.model.ChatMessage;
import com.mealscout.model.ChatRecord;
import com.mealscout.service.ChatNotFoundException;
import com.mealscout.service.ChatStore;
import com.mealscout.service.ConversationService;
import com.mealscout.service.TurnListener;
import com.mealscout.session.ChatLocks;
import com.mealscout.tools.AiToolExecutor;
import com.mealscout.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the assistant's run/poll loop for one chat turn and dispatches tool calls.
 */
@Service
@Slf4j
public class ConversationServiceImpl implements ConversationService {

    static final String FAILED_STATE_REPLY =
            "Error: OpenAI assistant entered failed state (state %s), start a new chat";
    static final String TIMED_OUT_REPLY =
            "Error: OpenAI assistant did not finish in time (state %s), start a new chat";

    private final AssistantClient assistantClient;
    private final AssistantBootstrap assistantBootstrap;
    private final AiToolExecutor toolExecutor;
    private final ChatStore chatStore;
    private final ChatLocks chatLocks;
    private final long pollIntervalMs;
    private final int maxPolls;

    public ConversationServiceImpl(AssistantClient assistantClient,
                                   AssistantBootstrap assistantBootstrap,
                                   AiToolExecutor toolExecutor,
                                   ChatStore chatStore,
                                   ChatLocks chatLocks,
                                   AiProperties aiProperties) {
        this.assistantClient = assistantClient;
        this.assistantBootstrap = assistantBootstrap;
        this.toolExecutor = toolExecutor;
        this.chatStore = chatStore;
        this.chatLocks = chatLocks;
        this.pollIntervalMs = Math.max(0, aiProperties.getRun().getPollIntervalMs());
        this.maxPolls = Math.max(1, aiProperties.getRun().getMaxPolls());
        log.info("Conversation service initialized pollIntervalMs={} maxPolls={}", pollIntervalMs, maxPolls);
    }

    @Override
    public String runTurn(String chatId, String userText, TurnListener listener) {
        ReentrantLock lock = chatLocks.of(chatId);
        lock.lock();
        try {
            log.info("Processing chat message chatId={}", chatId);
            String reply = converse(chatId, userText, listener == null ? TurnListener.NONE : listener);
            appendReply(chatId, reply);
            log.debug("Turn finished chatId={} reply={}", chatId, abbreviate(reply));
            return reply;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Mono<String> runTurnAsync(String chatId, String userText, TurnListener listener) {
        return Mono.fromCallable(() -> runTurn(chatId, userText, listener))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private String converse(String chatId, String userText, TurnListener listener) {
        try {
            chatStore.appendMessage(chatId, ChatMessage.user(userText));
            String threadId = resolveThread(chatId);
            assistantClient.addUserMessage(threadId, userText);
            RunSnapshot run = assistantClient.createRun(threadId, assistantBootstrap.assistantId());
            log.info("Created run runId={} threadId={} chatId={}", run.id(), threadId, chatId);
            return awaitRun(chatId, threadId, run, listener);
        } catch (Exception e) {
            log.error("Error in conversation turn chatId={}", chatId, e);
            return "Error: " + e.getMessage();
        }
    }

    private String resolveThread(String chatId) {
        ChatRecord chat = chatStore.findChat(chatId).orElseThrow(() -> new ChatNotFoundException(chatId));
        if (StringUtils.hasText(chat.getThreadId())) {
            return chat.getThreadId();
        }
        String threadId = assistantClient.createThread();
        chatStore.updateThreadId(chatId, threadId);
        log.info("Created thread threadId={} chatId={}", threadId, chatId);
        return threadId;
    }

    private String awaitRun(String chatId, String threadId, RunSnapshot run, TurnListener listener) {
        RunSnapshot current = run;
        int polls = 0;
        while (true) {
            switch (current.status()) {
                case COMPLETED -> {
                    return latestAssistantText(threadId);
                }
                case REQUIRES_ACTION -> {
                    if (polls >= maxPolls) {
                        return giveUp(chatId, threadId, current, polls);
                    }
                    List<ToolOutput> outputs = dispatch(chatId, current.toolCalls(), listener);
                    current = assistantClient.submitToolOutputs(threadId, current.id(), outputs);
                    // a tool round counts as a poll
                    polls++;
                    continue;
                }
                case FAILED, EXPIRED, CANCELLED, INCOMPLETE -> {
                    log.error("Run failed runId={} status={} chatId={}", current.id(), current.rawStatus(), chatId);
                    return String.format(FAILED_STATE_REPLY, current.rawStatus());
                }
                default -> {
                    // queued, in_progress, cancelling: keep polling
                }
            }

            if (polls >= maxPolls) {
                return giveUp(chatId, threadId, current, polls);
            }
            try {
                TimeUnit.MILLISECONDS.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for run runId={} chatId={}", current.id(), chatId);
                cancelQuietly(threadId, current.id());
                return String.format(TIMED_OUT_REPLY, current.rawStatus());
            }
            current = assistantClient.retrieveRun(threadId, current.id());
            polls++;
        }
    }

    private String giveUp(String chatId, String threadId, RunSnapshot current, int polls) {
        log.warn("Run runId={} still {} after {} poll(s) chatId={}", current.id(), current.rawStatus(), polls, chatId);
        cancelQuietly(threadId, current.id());
        return String.format(TIMED_OUT_REPLY, current.rawStatus());
    }

    private List<ToolOutput> dispatch(String chatId, List<PendingToolCall> calls, TurnListener listener) {
        log.debug("Executing {} tool call(s) chatId={}", calls.size(), chatId);
        List<ToolOutput> outputs = new ArrayList<>(calls.size());
        for (PendingToolCall call : calls) {
            ToolResult result;
            try {
                Map<String, Object> args = toolExecutor.parseArguments(call.argumentsJson());
                notifyListener(listener, chatId, call.name(), args);
                result = toolExecutor.invoke(call.name(), args, chatId);
            } catch (JsonProcessingException e) {
                log.warn("Unparseable arguments for tool '{}' chatId={}", call.name(), chatId, e);
                result = ToolResult.error(call.name(), "Invalid arguments: " + e.getOriginalMessage());
            }
            outputs.add(new ToolOutput(call.id(), toolExecutor.toOutputJson(result)));
        }
        return outputs;
    }

    private void notifyListener(TurnListener listener, String chatId, String toolName, Map<String, Object> args) {
        try {
            listener.onToolCall(chatId, toolName, args);
        } catch (RuntimeException e) {
            log.warn("Tool call listener failed tool={} chatId={}", toolName, chatId, e);
        }
    }

    private String latestAssistantText(String threadId) {
        return assistantClient.listMessages(threadId).stream()
                .filter(message -> ChatMessage.ASSISTANT.equals(message.role()))
                .map(ThreadMessage::text)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No assistant reply in thread " + threadId));
    }

    private void cancelQuietly(String threadId, String runId) {
        try {
            assistantClient.cancelRun(threadId, runId);
        } catch (RuntimeException e) {
            log.warn("Failed to cancel run runId={} threadId={}", runId, threadId, e);
        }
    }

    private void appendReply(String chatId, String reply) {
        try {
            chatStore.appendMessage(chatId, ChatMessage.assistant(reply));
        } catch (RuntimeException e) {
            log.error("Could not store assistant reply chatId={}", chatId, e);
        }
    }

    private static String abbreviate(String text) {
        return text != null && text.length() > 100 ? text.substring(0, 100) + "..." : text;
    }
}
