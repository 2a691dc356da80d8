package com.polyagent.orchestration.paradigm;

import static com.polyagent.orchestration.OrchestrationConstants.PURPOSE_WEAVER_ANALYSIS;
import static com.polyagent.orchestration.OrchestrationConstants.PURPOSE_WEAVER_REFINE;

import com.polyagent.agent.AgentHandle;
import com.polyagent.orchestration.InvocationScope;
import com.polyagent.orchestration.api.AgentInvocationService;
import com.polyagent.orchestration.model.AgentContribution;
import com.polyagent.orchestration.model.AgentInvocationResult;
import com.polyagent.orchestration.model.ParadigmPayload;
import com.polyagent.orchestration.model.WeaverPayload;
import com.polyagent.orchestration.service.CollaborationContextService;
import com.polyagent.orchestration.service.ParadigmPromptService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Two parallel passes: independent analyses are woven into one context, then every agent refines
 * its answer against that context.
 */
@Component
@RequiredArgsConstructor
public class WeaverStrategy implements ParadigmStrategy {

    private final AgentInvocationService invocationService;
    private final ParadigmPromptService promptService;
    private final CollaborationContextService contextService;

    @Override
    public Paradigm paradigm() {
        return Paradigm.WEAVER;
    }

    @Override
    public ParadigmPayload run(InvocationScope scope, String task, List<AgentHandle> agents) {
        if (agents.isEmpty()) {
            return new WeaverPayload("", List.of(), "", List.of());
        }
        Set<String> failedAgents = new LinkedHashSet<>();

        List<AgentInvocationResult> analyses = invocationService.invokeAll(scope, agents,
                promptService.weaverAnalysisTask(task), null, PURPOSE_WEAVER_ANALYSIS);
        ParadigmFailures.collect(analyses, failedAgents);
        if (ParadigmFailures.successes(analyses).isEmpty()) {
            throw ParadigmFailures.noSurvivors(scope, paradigm(), "context analysis", failedAgents);
        }
        String contextAnalysis = contextService.buildResultsContext(analyses);

        List<AgentInvocationResult> refinements = invocationService.invokeAll(scope, agents,
                promptService.weaverRefineTask(task), contextAnalysis, PURPOSE_WEAVER_REFINE);
        ParadigmFailures.collect(refinements, failedAgents);
        List<AgentInvocationResult> refined = ParadigmFailures.successes(refinements);
        if (refined.isEmpty()) {
            throw ParadigmFailures.noSurvivors(scope, paradigm(), "refinement", failedAgents);
        }
        return new WeaverPayload(contextAnalysis,
                refined.stream().map(AgentContribution::from).toList(),
                contextService.buildResultsContext(refined),
                List.copyOf(failedAgents));
    }
}
