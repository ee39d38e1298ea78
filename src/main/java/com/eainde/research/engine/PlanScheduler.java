package com.eainde.research.engine;

import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.Subtask;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Drives the {@link SubtaskRunner} over a plan, one ready subtask at a time.
 *
 * <p>Strictly sequential so the session's iteration log has a single, auditable order.
 * If no subtask is ready while some are incomplete (a dependency cycle or an unknown
 * dependency id) the loop stops and the plan stays partially complete.</p>
 */
@Slf4j
public class PlanScheduler {

    private final SubtaskRunner subtaskRunner;

    public PlanScheduler(SubtaskRunner subtaskRunner) {
        this.subtaskRunner = subtaskRunner;
    }

    public void runPlan(ResearchPlan plan, ResearchContext context) {
        while (!plan.isAllComplete()) {
            if (context.isCancelled()) {
                log.info("Cancellation requested, {}/{} subtasks complete",
                        plan.getCompletedCount(), plan.getSubtasks().size());
                return;
            }

            Optional<Subtask> next = plan.nextReady();
            if (next.isEmpty()) {
                log.warn("No runnable subtask while {} remain incomplete; stalled subtasks: {}",
                        plan.getSubtasks().size() - plan.getCompletedCount(),
                        plan.getSubtasks().stream().filter(st -> !st.isComplete()).map(Subtask::getId).toList());
                context.report("No runnable sub-task left, continuing with %d/%d complete",
                        plan.getCompletedCount(), plan.getSubtasks().size());
                return;
            }

            Subtask subtask = next.get();
            context.report("Starting sub-task %d/%d: \"%s\"",
                    plan.getCompletedCount() + 1, plan.getSubtasks().size(), subtask.getQuery());
            subtaskRunner.runSubtask(subtask, context);
        }
    }
}
