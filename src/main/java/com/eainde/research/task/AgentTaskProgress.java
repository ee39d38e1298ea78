package com.eainde.research.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A progress message published while a task runs.
 */
public record AgentTaskProgress(
        @JsonProperty("taskId")    String taskId,
        @JsonProperty("message")   String message,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("agentName") String agentName
) {}
