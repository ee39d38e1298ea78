package com.eainde.research.task;

import com.eainde.research.engine.CancellationToken;
import com.eainde.research.engine.IterativeResearchService;
import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.ResearchState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Runs queued agent tasks and publishes their outcome.
 *
 * <p>For each request:</p>
 * <ol>
 *   <li>Resolve the agent type; unknown types produce an UNSUPPORTED result</li>
 *   <li>Run research with an {@link AgentTaskContext} publishing progress under the task id</li>
 *   <li>Wrap the session into a JSON payload</li>
 *   <li>Publish COMPLETED, CANCELLED or FAILED through the broker</li>
 * </ol>
 *
 * <p>This is the only place where Finder/Critic failures are caught: the engine propagates them.</p>
 */
public class AgentTaskWorker {

    private static final Logger log = LoggerFactory.getLogger(AgentTaskWorker.class);

    static final String CANCELLED_MESSAGE = "Task was cancelled.";

    private final IterativeResearchService researchService;
    private final AgentTaskBroker broker;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AgentTaskWorker(IterativeResearchService researchService,
                           AgentTaskBroker broker,
                           ObjectMapper objectMapper,
                           Clock clock) {
        this.researchService = researchService;
        this.broker = broker;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Processes one request and publishes the result.
     *
     * @return the published result
     */
    public AgentTaskResult process(AgentTaskRequest request, CancellationToken cancellationToken) {
        log.info("Processing task {} of type {}", request.taskId(), request.agentType());

        AgentTaskResult result;
        Optional<AgentType> agentType = AgentType.parse(request.agentType());

        if (agentType.isEmpty()) {
            log.warn("Task {} requested unsupported agent type '{}'", request.taskId(), request.agentType());
            result = new AgentTaskResult(request.taskId(), AgentTaskStatus.UNSUPPORTED, null,
                    "Unsupported agent type: " + request.agentType(), clock.instant());
        } else {
            result = execute(agentType.get(), request, cancellationToken);
        }

        broker.publishResult(result);
        return result;
    }

    private AgentTaskResult execute(AgentType agentType, AgentTaskRequest request, CancellationToken cancellationToken) {
        try {
            return switch (agentType) {
                case RESEARCH -> executeResearch(request, cancellationToken);
            };
        } catch (RuntimeException e) {
            log.error("Task {} failed", request.taskId(), e);
            return new AgentTaskResult(request.taskId(), AgentTaskStatus.FAILED, null,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), clock.instant());
        }
    }

    private AgentTaskResult executeResearch(AgentTaskRequest request, CancellationToken cancellationToken) {
        AgentTaskContext taskContext = new AgentTaskContext(
                request.taskId(), AgentType.RESEARCH.wireName(), broker, clock);

        ResearchState state = researchService.research(request.prompt(), cancellationToken, List.of(taskContext));
        JsonNode data = toPayload(state, AgentType.RESEARCH);

        if (!state.isComplete()) {
            log.warn("Task {} was cancelled", request.taskId());
            return new AgentTaskResult(request.taskId(), AgentTaskStatus.CANCELLED, data,
                    CANCELLED_MESSAGE, clock.instant());
        }

        log.info("Task {} completed successfully", request.taskId());
        return new AgentTaskResult(request.taskId(), AgentTaskStatus.COMPLETED, data, null, clock.instant());
    }

    JsonNode toPayload(ResearchState state, AgentType agentType) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("text", state.getFinalSynthesis() != null ? state.getFinalSynthesis() : "");
        payload.put("agentType", agentType.wireName());
        payload.put("iterations", state.getCurrentIteration());
        payload.put("completedSubtasks", state.getPlan().map(ResearchPlan::getCompletedCount).orElse(0));
        payload.put("totalSubtasks", state.getPlan().map(p -> p.getSubtasks().size()).orElse(0));
        payload.put("isComplete", state.isComplete());
        payload.put("timestamp", clock.instant().toString());
        return payload;
    }
}
