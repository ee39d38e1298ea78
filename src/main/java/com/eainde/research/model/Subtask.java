package com.eainde.research.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A node of the research plan. The descriptive fields are fixed at planning time;
 * {@link #complete(String, int)} moves it to its terminal state once.
 */
public class Subtask {

    private final int id;
    private final String query;
    private final String rationale;
    private final Set<Integer> dependsOn;
    private final String expectedOutcome;

    private String findings;
    private Integer qualityScore;
    private boolean complete;

    public Subtask(int id, String query, String rationale, Set<Integer> dependsOn, String expectedOutcome) {
        this.id = id;
        this.query = Objects.requireNonNull(query, "query");
        this.rationale = rationale != null ? rationale : "";
        this.dependsOn = dependsOn != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn))
                : Set.of();
        this.expectedOutcome = expectedOutcome != null ? expectedOutcome : "";
    }

    public static Subtask from(SubtaskSpec spec) {
        return new Subtask(spec.id(), spec.query(), spec.rationale(),
                new LinkedHashSet<>(spec.dependsOn()), spec.expectedOutcome());
    }

    public int getId() {
        return id;
    }

    public String getQuery() {
        return query;
    }

    public String getRationale() {
        return rationale;
    }

    public Set<Integer> getDependsOn() {
        return dependsOn;
    }

    public String getExpectedOutcome() {
        return expectedOutcome;
    }

    public String getFindings() {
        return findings;
    }

    public Integer getQualityScore() {
        return qualityScore;
    }

    public boolean isComplete() {
        return complete;
    }

    /**
     * Records the accepted findings and marks the subtask complete.
     *
     * @throws IllegalStateException if the subtask was already completed
     */
    public void complete(String findings, int qualityScore) {
        if (complete) {
            throw new IllegalStateException("Subtask " + id + " is already complete");
        }
        this.findings = findings;
        this.qualityScore = qualityScore;
        this.complete = true;
    }

    @Override
    public String toString() {
        return "Subtask{id=" + id + ", query='" + query + "', dependsOn=" + dependsOn
                + ", complete=" + complete + '}';
    }
}
