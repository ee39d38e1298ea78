package com.eainde.research.task;

import com.eainde.research.engine.CancellationToken;
import com.eainde.research.engine.IterativeResearchService;
import com.eainde.research.engine.ProgressListener;
import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.ResearchState;
import com.eainde.research.model.Subtask;
import com.eainde.research.model.Verdict;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AgentTaskWorkerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock private IterativeResearchService researchService;
    @Mock private AgentTaskBroker broker;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final CancellationToken token = new CancellationToken();

    private AgentTaskWorker worker;

    @BeforeEach
    void setUp() {
        worker = new AgentTaskWorker(researchService, broker, new ObjectMapper(), clock);
    }

    private static AgentTaskRequest request(String agentType) {
        return new AgentTaskRequest("task-1", agentType, "Compare A and B", NOW);
    }

    private ResearchState completedState() {
        Subtask a = new Subtask(1, "A facts", "", Set.of(), "");
        Subtask b = new Subtask(2, "B facts", "", Set.of(), "");
        ResearchState state = new ResearchState("Compare A and B", clock);
        state.setPlan(new ResearchPlan("Compare A and B", List.of(a, b), ""));
        state.addIteration(1, "A facts", "A", Verdict.defaultOptimistic());
        a.complete("A", 7);
        state.addIteration(2, "B facts", "B", Verdict.defaultOptimistic());
        b.complete("B", 7);
        state.setFinalSynthesis("# Report");
        state.setComplete(true);
        return state;
    }

    @Test
    @DisplayName("should publish a completed result with the research payload")
    void completed() {
        when(researchService.research(eq("Compare A and B"), same(token), anyList())).thenReturn(completedState());

        AgentTaskResult result = worker.process(request("research"), token);

        assertThat(result.status()).isEqualTo(AgentTaskStatus.COMPLETED);
        assertThat(result.error()).isNull();
        assertThat(result.completedAt()).isEqualTo(NOW);

        JsonNode data = result.data();
        assertThat(data.get("text").asText()).isEqualTo("# Report");
        assertThat(data.get("agentType").asText()).isEqualTo("research");
        assertThat(data.get("iterations").asInt()).isEqualTo(2);
        assertThat(data.get("completedSubtasks").asInt()).isEqualTo(2);
        assertThat(data.get("totalSubtasks").asInt()).isEqualTo(2);
        assertThat(data.get("isComplete").asBoolean()).isTrue();
        assertThat(data.get("timestamp").asText()).isEqualTo("2026-03-01T12:00:00Z");

        verify(broker).publishResult(result);
    }

    @Test
    @DisplayName("should resolve the agent type case-insensitively")
    void caseInsensitiveType() {
        when(researchService.research(anyString(), any(CancellationToken.class), anyList()))
                .thenReturn(completedState());

        assertThat(worker.process(request(" Research "), token).status()).isEqualTo(AgentTaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("should forward engine progress to the broker under the task id")
    void forwardsProgress() {
        when(researchService.research(anyString(), any(CancellationToken.class), anyList())).thenAnswer(invocation -> {
            List<ProgressListener> listeners = invocation.getArgument(2);
            listeners.forEach(listener -> listener.onProgress("Planning research"));
            return completedState();
        });

        worker.process(request("research"), token);

        ArgumentCaptor<AgentTaskProgress> progress = ArgumentCaptor.forClass(AgentTaskProgress.class);
        verify(broker).publishProgress(progress.capture());
        assertThat(progress.getValue()).isEqualTo(
                new AgentTaskProgress("task-1", "Planning research", NOW, "research"));
    }

    @Test
    @DisplayName("should report unsupported agent types without running research")
    void unsupported() {
        AgentTaskResult result = worker.process(request("translator"), token);

        assertThat(result.status()).isEqualTo(AgentTaskStatus.UNSUPPORTED);
        assertThat(result.error()).isEqualTo("Unsupported agent type: translator");
        assertThat(result.data()).isNull();
        verify(researchService, never()).research(anyString(), any(CancellationToken.class), anyList());
        verify(broker).publishResult(result);
    }

    @Test
    @DisplayName("should report cancellation with the partial payload")
    void cancelled() {
        ResearchState partial = new ResearchState("Compare A and B", clock);
        partial.setFinalSynthesis("partial");
        when(researchService.research(anyString(), any(CancellationToken.class), anyList())).thenReturn(partial);

        AgentTaskResult result = worker.process(request("research"), token);

        assertThat(result.status()).isEqualTo(AgentTaskStatus.CANCELLED);
        assertThat(result.error()).isEqualTo(AgentTaskWorker.CANCELLED_MESSAGE);
        assertThat(result.data().get("text").asText()).isEqualTo("partial");
        assertThat(result.data().get("isComplete").asBoolean()).isFalse();
        assertThat(result.data().get("totalSubtasks").asInt()).isZero();
    }

    @Test
    @DisplayName("should turn a Finder or Critic failure into a failed result")
    void failed() {
        when(researchService.research(anyString(), any(CancellationToken.class), anyList()))
                .thenThrow(new IllegalStateException("model unavailable"));

        AgentTaskResult result = worker.process(request("research"), token);

        assertThat(result.status()).isEqualTo(AgentTaskStatus.FAILED);
        assertThat(result.error()).isEqualTo("model unavailable");
        assertThat(result.data()).isNull();
        verify(broker).publishResult(result);
    }

    @Test
    @DisplayName("should fail a task without an id instead of throwing")
    void blankTaskId() {
        AgentTaskResult result = worker.process(new AgentTaskRequest(" ", "research", "q", NOW), token);

        assertThat(result.status()).isEqualTo(AgentTaskStatus.FAILED);
        verify(researchService, never()).research(anyString(), any(CancellationToken.class), anyList());
    }
}
