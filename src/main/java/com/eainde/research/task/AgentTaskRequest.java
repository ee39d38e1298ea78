package com.eainde.research.task;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A unit of work delivered by the task queue.
 *
 * @param taskId      correlation id for progress and result messages
 * @param agentType   raw agent type name, resolved with {@link AgentType#parse(String)}
 * @param prompt      the research query
 * @param submittedAt when the caller queued the task
 */
public record AgentTaskRequest(
        @JsonProperty("taskId")      String taskId,
        @JsonProperty("agentType")   String agentType,
        @JsonProperty("prompt")      String prompt,
        @JsonProperty("submittedAt") Instant submittedAt
) {}
