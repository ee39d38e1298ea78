package com.eainde.research.task;

/**
 * Lifecycle of a queued agent task.
 */
public enum AgentTaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    /** The requested agent type is not served by this worker. */
    UNSUPPORTED
}
