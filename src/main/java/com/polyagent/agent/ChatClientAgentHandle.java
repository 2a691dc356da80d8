package com.polyagent.agent;

import static com.polyagent.orchestration.OrchestrationConstants.AGENT_USER_TEMPLATE;
import static com.polyagent.orchestration.OrchestrationConstants.NO_CONTEXT;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

/**
 * Agent backed by a Spring AI {@link ChatClient}. The client is shared; this handle only adds
 * the agent's system prompt and model options.
 */
@Slf4j
public class ChatClientAgentHandle implements AgentHandle {

    private final String id;
    private final int priority;
    private final ChatClient chatClient;
    private final String systemPrompt;
    @Nullable
    private final ChatOptions options;

    public ChatClientAgentHandle(String id, int priority, ChatClient chatClient, String systemPrompt,
                                 @Nullable ChatOptions options) {
        this.id = id;
        this.priority = priority;
        this.chatClient = chatClient;
        this.systemPrompt = systemPrompt;
        this.options = options;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public AgentResponse invoke(String task, @Nullable String context) throws AgentException {
        String normalizedContext = StringUtils.hasText(context) ? context : NO_CONTEXT;
        try {
            var request = chatClient.prompt();
            if (options != null) {
                request = request.options(options);
            }
            String content = request
                    .system(systemPrompt)
                    .user(user -> user.text(AGENT_USER_TEMPLATE)
                            .param("task", task)
                            .param("context", normalizedContext))
                    .call()
                    .content();
            if (!StringUtils.hasText(content)) {
                throw new AgentException(id, "Agent " + id + " returned an empty response.");
            }
            return new AgentResponse(id, content);
        } catch (AgentException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.debug("Chat call failed for agent {}: {}", id, ex.getMessage());
            throw new AgentException(id, "Agent " + id + " call failed: " + ex.getMessage(), ex);
        }
    }
}
