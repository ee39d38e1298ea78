package com.eainde.research.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The planner's decomposition of one research query into a dependency-ordered set of subtasks.
 *
 * <p>The plan owns its subtasks. Readiness is derived on every call, so the view is always
 * consistent with the subtasks' current completion flags.</p>
 */
public class ResearchPlan {

    static final String SECTION_SEPARATOR = "\n\n---\n\n";

    private final String originalQuery;
    private final List<Subtask> subtasks;
    private final String rationale;

    public ResearchPlan(String originalQuery, List<Subtask> subtasks, String rationale) {
        this.originalQuery = Objects.requireNonNull(originalQuery, "originalQuery");
        this.subtasks = List.copyOf(subtasks);
        this.rationale = rationale != null ? rationale : "";
    }

    public String getOriginalQuery() {
        return originalQuery;
    }

    public List<Subtask> getSubtasks() {
        return subtasks;
    }

    public String getRationale() {
        return rationale;
    }

    public boolean isAllComplete() {
        return subtasks.stream().allMatch(Subtask::isComplete);
    }

    public int getCompletedCount() {
        return (int) subtasks.stream().filter(Subtask::isComplete).count();
    }

    public List<Subtask> getCompletedSubtasks() {
        return subtasks.stream().filter(Subtask::isComplete).toList();
    }

    /**
     * First incomplete subtask, in plan order, whose dependencies are all complete.
     * A dependency on an id that is not in the plan is never satisfied.
     */
    public Optional<Subtask> nextReady() {
        for (Subtask subtask : subtasks) {
            if (subtask.isComplete()) {
                continue;
            }
            boolean dependenciesMet = subtask.getDependsOn().stream().allMatch(this::isComplete);
            if (dependenciesMet) {
                return Optional.of(subtask);
            }
        }
        return Optional.empty();
    }

    /**
     * Findings of every completed subtask under its own heading, separated by horizontal rules.
     * Empty string when nothing has completed.
     */
    public String getAllFindings() {
        StringBuilder sb = new StringBuilder();
        for (Subtask subtask : subtasks) {
            if (!subtask.isComplete() || subtask.getFindings() == null || subtask.getFindings().isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(SECTION_SEPARATOR);
            }
            sb.append("## Subtask ").append(subtask.getId()).append(": ").append(subtask.getQuery())
                    .append("\n\n")
                    .append(subtask.getFindings().trim());
        }
        return sb.toString();
    }

    private boolean isComplete(int subtaskId) {
        return subtasks.stream().anyMatch(st -> st.getId() == subtaskId && st.isComplete());
    }
}
