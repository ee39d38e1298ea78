package com.eainde.research.engine;

import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.ResearchState;
import com.eainde.research.model.Subtask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PlanSchedulerTest {

    @Mock private SubtaskRunner subtaskRunner;

    private final List<Integer> executionOrder = new ArrayList<>();
    private final List<String> progress = new ArrayList<>();
    private final CancellationToken token = new CancellationToken();

    private PlanScheduler scheduler;
    private ResearchContext context;

    @BeforeEach
    void setUp() {
        scheduler = new PlanScheduler(subtaskRunner);
        context = new ResearchContext(new ResearchState("q", Clock.systemUTC()), token, List.of(progress::add));
    }

    private void completeOnRun() {
        doAnswer(invocation -> {
            Subtask subtask = invocation.getArgument(0);
            executionOrder.add(subtask.getId());
            subtask.complete("findings " + subtask.getId(), 8);
            return null;
        }).when(subtaskRunner).runSubtask(any(Subtask.class), any(ResearchContext.class));
    }

    @Test
    void runPlan_runsDependenciesFirst() {
        completeOnRun();
        ResearchPlan plan = new ResearchPlan("q", List.of(
                new Subtask(3, "compare", "", Set.of(1, 2), ""),
                new Subtask(1, "a", "", Set.of(), ""),
                new Subtask(2, "b", "", Set.of(1), "")), "");

        scheduler.runPlan(plan, context);

        assertThat(executionOrder).containsExactly(1, 2, 3);
        assertThat(plan.isAllComplete()).isTrue();
        assertThat(progress).anyMatch(m -> m.startsWith("Starting sub-task 1/3"));
        assertThat(progress).anyMatch(m -> m.startsWith("Starting sub-task 3/3"));
    }

    @Test
    void runPlan_stopsWhenNothingIsReady() {
        completeOnRun();
        ResearchPlan plan = new ResearchPlan("q", List.of(
                new Subtask(1, "a", "", Set.of(), ""),
                new Subtask(2, "b", "", Set.of(3), ""),
                new Subtask(3, "c", "", Set.of(2), "")), "");

        scheduler.runPlan(plan, context);

        assertThat(executionOrder).containsExactly(1);
        assertThat(plan.getCompletedCount()).isEqualTo(1);
        assertThat(plan.isAllComplete()).isFalse();
        assertThat(progress).anyMatch(m -> m.contains("No runnable sub-task left"));
    }

    @Test
    void runPlan_doesNothingWhenAlreadyCancelled() {
        token.cancel();
        ResearchPlan plan = new ResearchPlan("q", List.of(new Subtask(1, "a", "", Set.of(), "")), "");

        scheduler.runPlan(plan, context);

        verify(subtaskRunner, never()).runSubtask(any(), any());
        assertThat(plan.getCompletedCount()).isZero();
    }

    @Test
    void runPlan_stopsBeforeNextSubtaskOnceCancelled() {
        doAnswer(invocation -> {
            Subtask subtask = invocation.getArgument(0);
            executionOrder.add(subtask.getId());
            subtask.complete("findings", 8);
            token.cancel();
            return null;
        }).when(subtaskRunner).runSubtask(any(Subtask.class), any(ResearchContext.class));
        ResearchPlan plan = new ResearchPlan("q", List.of(
                new Subtask(1, "a", "", Set.of(), ""),
                new Subtask(2, "b", "", Set.of(), "")), "");

        scheduler.runPlan(plan, context);

        assertThat(executionOrder).containsExactly(1);
    }
}
