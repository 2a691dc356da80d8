package com.polyagent.agent;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable agent double that records every task and context it receives.
 */
public class TestAgent implements AgentHandle {

    @FunctionalInterface
    public interface Behavior {
        String respond(String task, @Nullable String context) throws Exception;
    }

    private final String id;
    private final int priority;
    private final Behavior behavior;
    private final List<String> tasks = new CopyOnWriteArrayList<>();
    private final List<String> contexts = new CopyOnWriteArrayList<>();
    private final AtomicInteger invocations = new AtomicInteger();

    public TestAgent(String id, int priority, Behavior behavior) {
        this.id = id;
        this.priority = priority;
        this.behavior = behavior;
    }

    public static TestAgent replying(String id, String reply) {
        return new TestAgent(id, 0, (task, context) -> reply);
    }

    /**
     * Replies with the context it was given, so callers can assert what reached the agent.
     */
    public static TestAgent echoing(String id) {
        return new TestAgent(id, 0, (task, context) -> id + " received: " + context);
    }

    public static TestAgent failing(String id) {
        return new TestAgent(id, 0, (task, context) -> {
            throw new AgentException(id, "Agent " + id + " is down.");
        });
    }

    /**
     * Blocks until {@code release} opens or the thread is interrupted.
     */
    public static TestAgent blocking(String id, CountDownLatch started, CountDownLatch release) {
        return new TestAgent(id, 0, (task, context) -> {
            started.countDown();
            if (!release.await(10, TimeUnit.SECONDS)) {
                throw new AgentException(id, "Agent " + id + " was never released.");
            }
            return id + " finished";
        });
    }

    public TestAgent withPriority(int newPriority) {
        return new TestAgent(id, newPriority, behavior);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public int priority() {
        return priority;
    }

    @Override
    public AgentResponse invoke(String task, @Nullable String context) throws AgentException {
        invocations.incrementAndGet();
        tasks.add(task);
        contexts.add(context != null ? context : "");
        try {
            return new AgentResponse(id, behavior.respond(task, context));
        } catch (AgentException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new AgentException(id, "Agent " + id + " was interrupted.", ex);
        } catch (Exception ex) {
            throw new AgentException(id, ex.getMessage(), ex);
        }
    }

    public List<String> tasks() {
        return tasks;
    }

    public List<String> contexts() {
        return contexts;
    }

    public int invocations() {
        return invocations.get();
    }
}
