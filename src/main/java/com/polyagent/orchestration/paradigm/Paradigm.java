package com.polyagent.orchestration.paradigm;

import com.fasterxml.jackson.annotation.JsonValue;
import com.polyagent.orchestration.CollaborationErrorKind;
import com.polyagent.orchestration.CollaborationException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public enum Paradigm {
    ORCHESTRA("orchestra", "Multi-Agent CLI Orchestra",
            "Structured orchestration with specialized AI agents working in harmony",
            List.of("Role-based assignment", "Conductor coordination", "Specialized expertise")),
    MESH("mesh", "Conversational Code Mesh",
            "Natural language conversations between AI agents",
            List.of("Natural dialogue", "Context awareness", "Collaborative brainstorming")),
    SWARM("swarm", "Autonomous Code Swarm",
            "Self-organizing AI agents with emergent behaviors",
            List.of("Autonomous operation", "Emergent patterns", "Distributed coordination")),
    WEAVER("weaver", "Contextual Code Weaver",
            "Context-aware integration of multiple dimensions",
            List.of("Contextual analysis", "Multi-dimensional integration", "Business alignment")),
    ECOSYSTEM("ecosystem", "Emergent Code Ecosystem",
            "Living ecosystem where code and agents co-evolve",
            List.of("Evolutionary adaptation", "Ecosystem dynamics", "Emergent solutions"));

    private final String id;
    private final String label;
    private final String description;
    private final List<String> features;

    Paradigm(String id, String label, String description, List<String> features) {
        this.id = id;
        this.label = label;
        this.description = description;
        this.features = features;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String label() {
        return label;
    }

    public String description() {
        return description;
    }

    public List<String> features() {
        return features;
    }

    /**
     * Case-insensitive lookup by id.
     *
     * @throws CollaborationException of kind {@code UNKNOWN_PARADIGM} for anything else
     */
    public static Paradigm fromId(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Paradigm paradigm : values()) {
                if (paradigm.id.equals(normalized)) {
                    return paradigm;
                }
            }
        }
        throw new CollaborationException(CollaborationErrorKind.UNKNOWN_PARADIGM,
                "Unknown paradigm: " + value + ". Expected one of "
                        + Arrays.stream(values()).map(Paradigm::id).toList() + ".");
    }
}
