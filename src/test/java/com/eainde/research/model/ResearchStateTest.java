package com.eainde.research.model;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResearchStateTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private final ResearchState state = new ResearchState("What is X?", Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void newSession_isEmptyAndIncomplete() {
        assertThat(state.getOriginalQuery()).isEqualTo("What is X?");
        assertThat(state.getIterations()).isEmpty();
        assertThat(state.getCurrentIteration()).isZero();
        assertThat(state.getLatestEvaluation()).isEmpty();
        assertThat(state.getPlan()).isEmpty();
        assertThat(state.isComplete()).isFalse();
        assertThat(state.getFinalSynthesis()).isNull();
    }

    @Test
    void addIteration_numbersSequentiallyAndStampsWithClock() {
        Verdict low = new Verdict(false, 3, List.of("gap"), List.of(), "narrower", "weak", List.of());
        Verdict high = new Verdict(true, 9, List.of(), List.of(), null, "good", List.of());

        state.addIteration(1, "q1", "f1", low);
        IterationRecord second = state.addIteration(1, "q2", "f2", high);

        assertThat(second.iterationNumber()).isEqualTo(2);
        assertThat(second.subtaskId()).isEqualTo(1);
        assertThat(second.timestamp()).isEqualTo(NOW);
        assertThat(state.getCurrentIteration()).isEqualTo(2);
        assertThat(state.getLatestEvaluation()).contains(high);
        assertThat(state.getIterations()).extracting(IterationRecord::query).containsExactly("q1", "q2");
    }

    @Test
    void getIterations_isReadOnly() {
        state.addIteration(null, "q", "f", Verdict.defaultOptimistic());

        assertThatThrownBy(() -> state.getIterations().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void getAllFindings_sectionsEveryIteration() {
        state.addIteration(null, "q1", "f1", Verdict.defaultOptimistic());
        state.addIteration(null, "q2", "f2", Verdict.defaultOptimistic());

        assertThat(state.getAllFindings())
                .isEqualTo("## Iteration 1: q1\n\nf1\n\n---\n\n## Iteration 2: q2\n\nf2");
    }
}
