package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of the planner's decomposition, exactly as the Critic emitted it.
 *
 * @param id              unique within the plan
 * @param query           searchable query for the Finder
 * @param rationale       why this aspect needs investigation
 * @param dependsOn       ids of subtasks that must complete first
 * @param expectedOutcome what the findings should cover
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubtaskSpec(
        @JsonProperty("id")              int id,
        @JsonProperty("query")           String query,
        @JsonProperty("rationale")       String rationale,
        @JsonProperty("dependsOn")       List<Integer> dependsOn,
        @JsonProperty("expectedOutcome") String expectedOutcome
) {

    public SubtaskSpec {
        query = query == null ? "" : query;
        rationale = rationale == null ? "" : rationale;
        dependsOn = Verdict.nonNullCopy(dependsOn);
        expectedOutcome = expectedOutcome == null ? "" : expectedOutcome;
    }
}
