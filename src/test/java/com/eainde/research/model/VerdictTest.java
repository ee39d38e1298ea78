package com.eainde.research.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class VerdictTest {

    @Test
    void defaultOptimistic_acceptsWithScoreSeven() {
        Verdict verdict = Verdict.defaultOptimistic();

        assertThat(verdict.isSatisfactory()).isTrue();
        assertThat(verdict.qualityScore()).isEqualTo(Verdict.DEFAULT_QUALITY_SCORE);
        assertThat(verdict.reasoning()).isEqualTo(Verdict.PARSE_FAILURE_REASONING);
        assertThat(verdict.hasRefinedQuery()).isFalse();
        assertThat(verdict.hasSubtasks()).isFalse();
    }

    @Test
    void constructor_replacesNullsWithEmptyValues() {
        Verdict verdict = new Verdict(false, 4, null, Arrays.asList("q", null), null, null, null);

        assertThat(verdict.gaps()).isEmpty();
        assertThat(verdict.followUpQuestions()).containsExactly("q");
        assertThat(verdict.reasoning()).isEmpty();
        assertThat(verdict.subtasks()).isEmpty();
    }

    @Test
    void hasRefinedQuery_ignoresBlank() {
        assertThat(new Verdict(false, 1, null, null, "  ", "", null).hasRefinedQuery()).isFalse();
        assertThat(new Verdict(false, 1, null, null, "better", "", null).hasRefinedQuery()).isTrue();
    }
}
