package com.mealscout.assistant;

import com.mealscout.assistant.dto.AssistantDefinition;
import com.mealscout.assistant.dto.RunSnapshot;
import com.mealscout.assistant.dto.ThreadMessage;
import com.mealscout.assistant.dto.ToolOutput;

import java.util.List;
import java.util.Optional;

/**
 * The assistant service's thread and run API.
 */
public interface AssistantClient {

    /**
     * @return the id when the assistant exists, empty when the service does not know it
     */
    Optional<String> retrieveAssistant(String assistantId);

    String createAssistant(AssistantDefinition definition);

    String createThread();

    void addUserMessage(String threadId, String content);

    RunSnapshot createRun(String threadId, String assistantId);

    RunSnapshot retrieveRun(String threadId, String runId);

    RunSnapshot submitToolOutputs(String threadId, String runId, List<ToolOutput> outputs);

    RunSnapshot cancelRun(String threadId, String runId);

    /**
     * Messages of a thread, newest first.
     */
    List<ThreadMessage> listMessages(String threadId);
}
