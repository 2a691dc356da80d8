package com.polyagent.config;

import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the agent registration table.
 * The map key under {@code polyagent.agents} is the agent id callers use.
 */
public class AgentDefinition {

    public enum Provider {
        GOOGLE, OPENAI, MOCK
    }

    private Provider provider = Provider.MOCK;
    private String name;
    private String model;
    private String systemPrompt;
    private String description;
    private int priority;
    private List<String> capabilities = new ArrayList<>();

    public AgentDefinition() {
    }

    public AgentDefinition(Provider provider, String model, int priority) {
        this.provider = provider;
        this.model = model;
        this.priority = priority;
    }

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public List<String> getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(List<String> capabilities) {
        this.capabilities = capabilities != null ? new ArrayList<>(capabilities) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AgentDefinition{" +
                "provider=" + provider +
                ", model='" + model + '\'' +
                ", priority=" + priority +
                '}';
    }
}
