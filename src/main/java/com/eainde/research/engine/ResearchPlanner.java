package com.eainde.research.engine;

import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.Subtask;
import com.eainde.research.model.Verdict;
import com.eainde.research.parse.ResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Asks the planning Critic to decompose a query into a plan of subtasks.
 *
 * <p>An empty result is not an error: the caller falls back to a single direct Finder call.</p>
 */
public class ResearchPlanner {

    private static final Logger log = LoggerFactory.getLogger(ResearchPlanner.class);

    private final Critic planningCritic;
    private final ResponseParser responseParser;

    public ResearchPlanner(Critic planningCritic, ResponseParser responseParser) {
        this.planningCritic = planningCritic;
        this.responseParser = responseParser;
    }

    /**
     * @param query the original research query
     * @return the plan, or empty when the Critic produced no subtasks
     */
    public Optional<ResearchPlan> decompose(String query) {
        String response = planningCritic.evaluate(ResearchPrompts.decomposition(query));
        log.debug("Planner response: {}", response);

        Verdict verdict = responseParser.parseVerdict(response);
        if (!verdict.hasSubtasks()) {
            log.info("Planner returned no subtasks for query '{}'", query);
            return Optional.empty();
        }

        List<Subtask> subtasks = verdict.subtasks().stream()
                .map(Subtask::from)
                .toList();

        log.info("Planner decomposed query into {} subtasks", subtasks.size());
        return Optional.of(new ResearchPlan(query, subtasks, verdict.reasoning()));
    }
}
