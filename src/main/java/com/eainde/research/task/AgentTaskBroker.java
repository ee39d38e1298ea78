package com.eainde.research.task;

/**
 * Pub/sub boundary towards the caller that queued the task.
 * Delivery guarantees are up to the implementation.
 */
public interface AgentTaskBroker {

    void publishProgress(AgentTaskProgress progress);

    void publishResult(AgentTaskResult result);
}
