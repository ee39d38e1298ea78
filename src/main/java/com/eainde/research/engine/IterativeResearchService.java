package com.eainde.research.engine;

import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.ResearchState;
import com.eainde.research.model.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the research engine.
 *
 * <h3>Phases:</h3>
 * <ol>
 *   <li>Plan: the planning Critic decomposes the query into subtasks</li>
 *   <li>Execute: subtasks run one at a time, each refined until satisfactory</li>
 *   <li>Synthesize: completed findings are combined into the final report</li>
 * </ol>
 *
 * <p>If planning yields no subtasks the query is researched with a single Finder call,
 * recorded as one iteration with the default verdict. Only Finder and Critic failures
 * escape this class; every other problem degrades into a valid, possibly partial, result.</p>
 */
public class IterativeResearchService {

    private static final Logger log = LoggerFactory.getLogger(IterativeResearchService.class);

    private final ResearchPlanner planner;
    private final PlanScheduler scheduler;
    private final ResearchSynthesizer synthesizer;
    private final Finder finder;
    private final Clock clock;

    public IterativeResearchService(ResearchPlanner planner,
                                    PlanScheduler scheduler,
                                    ResearchSynthesizer synthesizer,
                                    Finder finder,
                                    Clock clock) {
        this.planner = Objects.requireNonNull(planner, "planner");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
        this.finder = Objects.requireNonNull(finder, "finder");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ResearchState research(String query, CancellationToken cancellationToken, ProgressListener... listeners) {
        return research(query, cancellationToken, List.of(listeners));
    }

    /**
     * Researches {@code query} to completion, cancellation, or stall.
     *
     * @param query             the research question, must not be blank
     * @param cancellationToken polled between subtasks and between iterations
     * @param listeners         progress observers, may be empty
     * @return the session state; {@code isComplete} is false only when cancelled
     * @throws IllegalArgumentException if {@code query} is null or blank
     */
    public ResearchState research(String query, CancellationToken cancellationToken, List<ProgressListener> listeners) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }

        ResearchState state = new ResearchState(query, clock);
        ResearchContext context = new ResearchContext(state, cancellationToken, listeners);

        log.info("Starting research: '{}'", query);
        context.report("Planning research for \"%s\"", query);

        Optional<ResearchPlan> plan = planner.decompose(query);
        if (plan.isEmpty()) {
            researchDirectly(context);
            return state;
        }

        ResearchPlan researchPlan = plan.get();
        state.setPlan(researchPlan);
        context.report("Created %d sub-tasks: %s", researchPlan.getSubtasks().size(), researchPlan.getRationale());

        scheduler.runPlan(researchPlan, context);

        if (context.isCancelled() && !researchPlan.isAllComplete()) {
            log.info("Research cancelled with {}/{} subtasks complete",
                    researchPlan.getCompletedCount(), researchPlan.getSubtasks().size());
            state.setFinalSynthesis(researchPlan.getAllFindings());
            context.report("Research cancelled after %d iteration(s)", state.getCurrentIteration());
            return state;
        }

        context.report("Synthesizing findings from %d/%d sub-tasks...",
                researchPlan.getCompletedCount(), researchPlan.getSubtasks().size());
        state.setFinalSynthesis(synthesizer.synthesize(researchPlan));
        state.setComplete(true);

        log.info("Research complete: {} iteration(s), {}/{} subtasks",
                state.getCurrentIteration(), researchPlan.getCompletedCount(), researchPlan.getSubtasks().size());
        context.report("Research complete after %d iteration(s)", state.getCurrentIteration());
        return state;
    }

    /**
     * Single-shot fallback used when the planner produced no subtasks.
     */
    private void researchDirectly(ResearchContext context) {
        ResearchState state = context.state();
        context.report("Task decomposition failed, researching the query directly");

        String findings = Objects.requireNonNullElse(finder.find(state.getOriginalQuery()), SubtaskRunner.NO_FINDINGS);
        state.addIteration(null, state.getOriginalQuery(), findings, Verdict.defaultOptimistic());
        state.setFinalSynthesis(findings);
        state.setComplete(true);

        log.info("Single-shot research complete for '{}'", state.getOriginalQuery());
        context.report("Research complete after 1 iteration");
    }
}
