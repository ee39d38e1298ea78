package com.eainde.research.model;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * State of one research session: the append-only iteration log, the executed plan
 * and the final synthesis.
 *
 * <p>Lives for a single {@code research(...)} call and is never shared between sessions.</p>
 */
public class ResearchState {

    private final String originalQuery;
    private final Clock clock;
    private final List<IterationRecord> iterations = new ArrayList<>();

    private ResearchPlan plan;
    private boolean complete;
    private String finalSynthesis;

    public ResearchState(String originalQuery, Clock clock) {
        this.originalQuery = Objects.requireNonNull(originalQuery, "originalQuery");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String getOriginalQuery() {
        return originalQuery;
    }

    public List<IterationRecord> getIterations() {
        return Collections.unmodifiableList(iterations);
    }

    public int getCurrentIteration() {
        return iterations.size();
    }

    public Optional<Verdict> getLatestEvaluation() {
        return iterations.isEmpty()
                ? Optional.empty()
                : Optional.of(iterations.get(iterations.size() - 1).evaluation());
    }

    /**
     * Appends a round to the log, numbering it after the last one.
     */
    public IterationRecord addIteration(Integer subtaskId, String query, String findings, Verdict evaluation) {
        IterationRecord iteration = new IterationRecord(
                iterations.size() + 1,
                subtaskId,
                query,
                findings,
                evaluation,
                clock.instant());
        iterations.add(iteration);
        return iteration;
    }

    public String getAllFindings() {
        return iterations.stream()
                .map(i -> "## Iteration " + i.iterationNumber() + ": " + i.query() + "\n\n" + i.findings())
                .collect(Collectors.joining(ResearchPlan.SECTION_SEPARATOR));
    }

    public Optional<ResearchPlan> getPlan() {
        return Optional.ofNullable(plan);
    }

    public void setPlan(ResearchPlan plan) {
        this.plan = plan;
    }

    public boolean isComplete() {
        return complete;
    }

    public void setComplete(boolean complete) {
        this.complete = complete;
    }

    public String getFinalSynthesis() {
        return finalSynthesis;
    }

    public void setFinalSynthesis(String finalSynthesis) {
        this.finalSynthesis = finalSynthesis;
    }
}
