package com.polyagent.metrics;

import java.time.Duration;

/**
 * Receives one record per agent invocation. Implementations must not throw.
 */
public interface MetricsSink {

    void record(String agentId, Duration duration, boolean success);
}
