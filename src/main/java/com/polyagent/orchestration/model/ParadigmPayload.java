package com.polyagent.orchestration.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Paradigm-specific part of a collaboration result. The {@code paradigm} property names the variant.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "paradigm")
@JsonSubTypes({
        @JsonSubTypes.Type(value = OrchestraPayload.class, name = "orchestra"),
        @JsonSubTypes.Type(value = MeshPayload.class, name = "mesh"),
        @JsonSubTypes.Type(value = SwarmPayload.class, name = "swarm"),
        @JsonSubTypes.Type(value = WeaverPayload.class, name = "weaver"),
        @JsonSubTypes.Type(value = EcosystemPayload.class, name = "ecosystem")
})
public interface ParadigmPayload {

    /**
     * Agents whose failures were absorbed while producing this payload, in the order they failed.
     */
    List<String> failedAgents();

    /**
     * Plain-text digest of the payload, used when the result is handed to another service.
     */
    @JsonIgnore
    String summaryText();
}
