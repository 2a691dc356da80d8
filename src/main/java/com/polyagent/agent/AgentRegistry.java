package com.polyagent.agent;

import static com.polyagent.orchestration.OrchestrationConstants.AGENT_SYSTEM_PROMPT;

import com.polyagent.config.AgentDefinition;
import com.polyagent.config.PolyAgentProperties;
import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.CollaborationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.google.genai.GoogleGenAiChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registration table of agent factories keyed by agent id.
 * Built once from {@code polyagent.agents}; misconfigured entries fail startup.
 */
@Service
@Slf4j
public class AgentRegistry implements AgentHandleProvider {

    private final Map<String, Supplier<AgentHandle>> factories = new ConcurrentHashMap<>();
    private final Map<String, AgentDescriptor> descriptors = new ConcurrentHashMap<>();
    private final List<String> order = new ArrayList<>();

    public AgentRegistry(PolyAgentProperties properties,
                         @Qualifier("googleChatClient") ObjectProvider<ChatClient> googleChatClientProvider,
                         @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider) {
        ChatClient googleChatClient = googleChatClientProvider.getIfAvailable();
        ChatClient openAiChatClient = openAiChatClientProvider.getIfAvailable();
        properties.getAgents().forEach((id, definition) ->
                registerDefinition(id, definition, googleChatClient, openAiChatClient));
        for (String defaultAgent : properties.getDefaultAgents()) {
            if (!factories.containsKey(defaultAgent)) {
                throw new IllegalStateException("Default agent '" + defaultAgent + "' is not registered under polyagent.agents.");
            }
        }
        log.info("Agent registry initialized with {} agents: {}.", order.size(), order);
    }

    @Override
    public AgentHandle resolve(String agentId) {
        Supplier<AgentHandle> factory = agentId != null ? factories.get(agentId) : null;
        if (factory == null) {
            throw new CollaborationException(CollaborationErrorKind.UNKNOWN_AGENT, "Unknown agent: " + agentId);
        }
        return factory.get();
    }

    @Override
    public boolean isRegistered(String agentId) {
        return agentId != null && factories.containsKey(agentId);
    }

    @Override
    public synchronized List<AgentDescriptor> describeAgents() {
        return order.stream().map(descriptors::get).toList();
    }

    private synchronized void registerDefinition(String id, AgentDefinition definition,
                                                 @Nullable ChatClient googleChatClient,
                                                 @Nullable ChatClient openAiChatClient) {
        AgentDefinition.Provider provider = definition.getProvider() != null
                ? definition.getProvider()
                : AgentDefinition.Provider.MOCK;
        String systemPrompt = StringUtils.hasText(definition.getSystemPrompt())
                ? definition.getSystemPrompt()
                : AGENT_SYSTEM_PROMPT.formatted(displayName(id, definition));
        int priority = definition.getPriority();
        Supplier<AgentHandle> factory = switch (provider) {
            case GOOGLE -> {
                ChatClient client = requireClient(id, provider, googleChatClient);
                ChatOptions options = StringUtils.hasText(definition.getModel())
                        ? GoogleGenAiChatOptions.builder().model(definition.getModel()).build()
                        : null;
                yield () -> new ChatClientAgentHandle(id, priority, client, systemPrompt, options);
            }
            case OPENAI -> {
                ChatClient client = requireClient(id, provider, openAiChatClient);
                ChatOptions options = StringUtils.hasText(definition.getModel())
                        ? OpenAiChatOptions.builder().model(definition.getModel()).build()
                        : null;
                yield () -> new ChatClientAgentHandle(id, priority, client, systemPrompt, options);
            }
            case MOCK -> () -> new MockAgentHandle(id, priority);
        };
        factories.put(id, factory);
        descriptors.put(id, new AgentDescriptor(id, displayName(id, definition), provider.name(),
                definition.getModel(), priority, definition.getDescription(), List.copyOf(definition.getCapabilities())));
        order.add(id);
        log.debug("Registered agent {} (provider={}, model={}, priority={}).", id, provider, definition.getModel(), priority);
    }

    private ChatClient requireClient(String id, AgentDefinition.Provider provider, @Nullable ChatClient client) {
        if (client == null) {
            throw new IllegalStateException("Agent '" + id + "' uses provider " + provider
                    + " but no chat model is configured for it. "
                    + "Check that you have a valid API key or a custom Base URL in your configuration.");
        }
        return client;
    }

    private String displayName(String id, AgentDefinition definition) {
        return StringUtils.hasText(definition.getName()) ? definition.getName() : id;
    }
}
