package com.eainde.research.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * The Critic's judgement of a piece of text.
 *
 * <p>Produced by {@link com.eainde.research.parse.ResponseParser} from free-form model output.
 * The {@code subtasks} list is only populated when the Critic acts as planner.</p>
 *
 * @param isSatisfactory    whether the Critic considers the findings good enough
 * @param qualityScore      1-10 by Critic contract; not clamped here
 * @param gaps              specific missing pieces, in the Critic's order
 * @param followUpQuestions targeted questions that would close the gaps
 * @param refinedQuery      search-optimised query for the next iteration, or null
 * @param reasoning         explanation of the score
 * @param subtasks          decomposition, planner mode only
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Verdict(
        @JsonProperty("isSatisfactory")    boolean isSatisfactory,
        @JsonProperty("qualityScore")      int qualityScore,
        @JsonProperty("gaps")              List<String> gaps,
        @JsonProperty("followUpQuestions") List<String> followUpQuestions,
        @JsonProperty("refinedQuery")      String refinedQuery,
        @JsonProperty("reasoning")         String reasoning,
        @JsonProperty("subtasks") @JsonAlias("subTasks") List<SubtaskSpec> subtasks
) {

    public static final int DEFAULT_QUALITY_SCORE = 7;

    static final String PARSE_FAILURE_REASONING =
            "Evaluation parsing failed, accepting research as satisfactory.";

    public Verdict {
        gaps = nonNullCopy(gaps);
        followUpQuestions = nonNullCopy(followUpQuestions);
        reasoning = reasoning == null ? "" : reasoning;
        subtasks = nonNullCopy(subtasks);
    }

    /**
     * Verdict substituted whenever the Critic's reply cannot be understood.
     * Optimistic so that a malformed reply never stalls the pipeline.
     */
    public static Verdict defaultOptimistic() {
        return new Verdict(true, DEFAULT_QUALITY_SCORE, List.of(), List.of(), null,
                PARSE_FAILURE_REASONING, List.of());
    }

    public boolean hasSubtasks() {
        return !subtasks.isEmpty();
    }

    public boolean hasRefinedQuery() {
        return refinedQuery != null && !refinedQuery.isBlank();
    }

    static <T> List<T> nonNullCopy(List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }
}
