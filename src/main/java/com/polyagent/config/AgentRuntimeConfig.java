package com.polyagent.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AgentRuntimeConfig {

    @Bean
    public ChatClient googleChatClient(ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModelProvider) {
        return googleGenAiChatModelProvider.getIfAvailable() != null
                ? ChatClient.builder(googleGenAiChatModelProvider.getIfAvailable()).build()
                : null;
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        return openAiChatModelProvider.getIfAvailable() != null
                ? ChatClient.builder(openAiChatModelProvider.getIfAvailable()).build()
                : null;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentWorkerExecutor(PolyAgentProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerConcurrency());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService collaborationExecutor() {
        return Executors.newCachedThreadPool();
    }
}
