package com.polyagent.api;

import com.polyagent.orchestration.paradigm.Paradigm;

import java.util.List;

public record ParadigmResponse(
        String id,
        String name,
        String description,
        List<String> features
) {
    public static ParadigmResponse from(Paradigm paradigm) {
        return new ParadigmResponse(paradigm.id(), paradigm.label(), paradigm.description(), paradigm.features());
    }
}
