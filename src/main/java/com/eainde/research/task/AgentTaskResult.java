package com.eainde.research.task;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Final outcome of a task. {@code data} is present for completed and cancelled research,
 * {@code error} for every other non-success status.
 */
public record AgentTaskResult(
        @JsonProperty("taskId")      String taskId,
        @JsonProperty("status")      AgentTaskStatus status,
        @JsonProperty("data")        JsonNode data,
        @JsonProperty("error")       String error,
        @JsonProperty("completedAt") Instant completedAt
) {}
