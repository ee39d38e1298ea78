package com.eainde.research.task;

import com.eainde.research.engine.ProgressListener;

import java.time.Clock;
import java.util.Objects;

/**
 * Correlates progress messages of one running task with its task id.
 * Created per task by {@link AgentTaskWorker} and handed to the engine as a listener.
 */
public final class AgentTaskContext implements ProgressListener {

    private final String taskId;
    private final String agentName;
    private final AgentTaskBroker broker;
    private final Clock clock;

    public AgentTaskContext(String taskId, String agentName, AgentTaskBroker broker, Clock clock) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        this.taskId = taskId;
        this.agentName = agentName;
        this.broker = Objects.requireNonNull(broker, "broker");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String getTaskId() {
        return taskId;
    }

    @Override
    public void onProgress(String message) {
        broker.publishProgress(new AgentTaskProgress(taskId, message, clock.instant(), agentName));
    }

    @Override
    public String toString() {
        return "AgentTaskContext{taskId='" + taskId + "', agentName='" + agentName + "'}";
    }
}
