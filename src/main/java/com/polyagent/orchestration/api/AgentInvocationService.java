package com.polyagent.orchestration.api;

import com.polyagent.agent.AgentHandle;
import com.polyagent.orchestration.InvocationScope;
import com.polyagent.orchestration.model.AgentInvocationResult;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.function.Function;

/**
 * Single call site for agent invocations. Every call is timed, bounded by the per-call timeout and
 * the scope deadline, recorded to the metrics sink and published on the session stream.
 * Agent failures and timeouts come back as failed results; they are never thrown.
 */
public interface AgentInvocationService {

    /**
     * Invokes one agent and waits for its result.
     *
     * @param scope The collaboration scope the call belongs to.
     * @param handle The agent to call.
     * @param task The task text sent to the agent.
     * @param context Optional context accumulated by the paradigm.
     * @param purpose Short label for logs and stream events.
     * @return The invocation result, successful or not.
     * @throws java.util.concurrent.CancellationException if the scope is cancelled or past its deadline.
     */
    AgentInvocationResult invoke(InvocationScope scope,
                                 AgentHandle handle,
                                 String task,
                                 @Nullable String context,
                                 String purpose);

    /**
     * Invokes all agents concurrently with a per-agent task and returns their results in the order of
     * {@code handles}.
     *
     * @param taskFor Supplies the task text for each agent.
     * @param contextFor Supplies the context for each agent.
     * @throws java.util.concurrent.CancellationException if the scope is cancelled or past its deadline.
     */
    List<AgentInvocationResult> invokeAll(InvocationScope scope,
                                          List<AgentHandle> handles,
                                          Function<AgentHandle, String> taskFor,
                                          Function<AgentHandle, String> contextFor,
                                          String purpose);

    default List<AgentInvocationResult> invokeAll(InvocationScope scope,
                                                  List<AgentHandle> handles,
                                                  String task,
                                                  @Nullable String context,
                                                  String purpose) {
        return invokeAll(scope, handles, handle -> task, handle -> context, purpose);
    }
}
