package com.polyagent.orchestration.service;

import static com.polyagent.orchestration.OrchestrationConstants.*;

import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ParadigmPromptService {

    public String conductorTask(String task, List<String> agentIds) {
        return CONDUCTOR_TASK.formatted(task, String.join(", ", agentIds));
    }

    public String orchestraMemberTask(String task, String agentId) {
        return ORCHESTRA_MEMBER_TASK.formatted(task, agentId);
    }

    public String meshTurnTask(String task, int round) {
        return MESH_TURN_TASK.formatted(task, round);
    }

    public String swarmTask(String task) {
        return SWARM_TASK.formatted(task);
    }

    public String weaverAnalysisTask(String task) {
        return WEAVER_ANALYSIS_TASK.formatted(task);
    }

    public String weaverRefineTask(String task) {
        return WEAVER_REFINE_TASK.formatted(task);
    }

    public String ecosystemTask(String task, int generation) {
        return ECOSYSTEM_TASK.formatted(task, generation);
    }
}
