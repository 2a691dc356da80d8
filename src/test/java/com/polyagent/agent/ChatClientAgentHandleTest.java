package com.polyagent.agent;

import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;

import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatClientAgentHandleTest {

    private final ChatClient chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
    private final ChatClientAgentHandle handle = new ChatClientAgentHandle("gemini", 10, chatClient, "system", null);

    @SuppressWarnings("unchecked")
    private void stubContent(String content) {
        when(chatClient.prompt().system(anyString()).user(any(Consumer.class)).call().content()).thenReturn(content);
    }

    @Test
    void testInvokeReturnsContent() throws Exception {
        stubContent("Use a token bucket.");

        AgentResponse response = handle.invoke("Design a limiter", null);

        assertEquals("gemini", response.agentId());
        assertEquals("Use a token bucket.", response.response());
    }

    @Test
    void testEmptyContentIsAnError() {
        stubContent("  ");

        AgentException ex = assertThrows(AgentException.class, () -> handle.invoke("task", "context"));
        assertEquals("gemini", ex.getAgentId());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testProviderFailureIsWrapped() {
        when(chatClient.prompt().system(anyString()).user(any(Consumer.class)).call())
                .thenThrow(new IllegalStateException("quota exceeded"));

        AgentException ex = assertThrows(AgentException.class, () -> handle.invoke("task", null));
        assertTrue(ex.getMessage().contains("quota exceeded"));
    }
}
