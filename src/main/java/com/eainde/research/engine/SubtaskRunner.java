package com.eainde.research.engine;

import com.eainde.research.model.Subtask;
import com.eainde.research.model.Verdict;
import com.eainde.research.parse.ResponseParser;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Runs the refine-until-satisfactory loop for a single subtask.
 *
 * <h3>Per iteration:</h3>
 * <ol>
 *   <li>query the Finder (verbatim subtask query first, a refinement prompt afterwards)</li>
 *   <li>have the Critic evaluate the findings against the subtask's expected outcome</li>
 *   <li>log the round in the session</li>
 *   <li>accept when satisfactory and at or above the quality threshold</li>
 *   <li>otherwise continue with the Critic's refined query, or its first follow-up question;
 *       with neither, accept the current findings</li>
 * </ol>
 *
 * <p>When the iteration budget runs out, or cancellation is observed between iterations,
 * the last round's findings and score are accepted. A subtask handed to this runner is
 * always complete when it returns normally.</p>
 */
@Slf4j
public class SubtaskRunner {

    public static final String NO_FINDINGS = "No findings returned.";

    private final Finder finder;
    private final Critic evaluationCritic;
    private final ResponseParser responseParser;
    private final int maxIterations;
    private final int qualityThreshold;
    private final int findingsPreviewLength;

    public SubtaskRunner(Finder finder,
                         Critic evaluationCritic,
                         ResponseParser responseParser,
                         int maxIterations,
                         int qualityThreshold,
                         int findingsPreviewLength) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        if (findingsPreviewLength < 0) throw new IllegalArgumentException("findingsPreviewLength must be >= 0");
        this.finder = Objects.requireNonNull(finder, "finder");
        this.evaluationCritic = Objects.requireNonNull(evaluationCritic, "evaluationCritic");
        this.responseParser = Objects.requireNonNull(responseParser, "responseParser");
        this.maxIterations = maxIterations;
        this.qualityThreshold = qualityThreshold;
        this.findingsPreviewLength = findingsPreviewLength;
    }

    public void runSubtask(Subtask subtask, ResearchContext context) {
        String originalQuery = context.state().getOriginalQuery();
        String query = subtask.getQuery();
        String lastFindings = null;
        Verdict lastVerdict = null;

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            if (iteration > 1 && context.isCancelled()) {
                log.info("Cancellation requested, stopping subtask {} after {} iteration(s)",
                        subtask.getId(), iteration - 1);
                break;
            }

            context.report("Subtask %d, iteration %d: researching \"%s\"",
                    subtask.getId(), iteration, subtask.getQuery());
            String findings = Objects.requireNonNullElse(finder.find(query), NO_FINDINGS);

            context.report("Subtask %d, iteration %d: evaluating findings...", subtask.getId(), iteration);
            String evaluation = evaluationCritic.evaluate(ResearchPrompts.evaluation(
                    originalQuery, subtask.getQuery(), subtask.getExpectedOutcome(), findings));
            Verdict verdict = responseParser.parseVerdict(evaluation);

            context.state().addIteration(subtask.getId(), query, findings, verdict);
            context.report("Subtask %d, iteration %d: score %d/10, satisfactory: %s",
                    subtask.getId(), iteration, verdict.qualityScore(), verdict.isSatisfactory());

            lastFindings = findings;
            lastVerdict = verdict;

            if (verdict.isSatisfactory() && verdict.qualityScore() >= qualityThreshold) {
                accept(subtask, findings, verdict, context, "meets quality threshold");
                return;
            }

            Optional<String> nextQuery = chooseNextQuery(verdict);
            if (nextQuery.isEmpty()) {
                accept(subtask, findings, verdict, context, "no refinement suggested");
                return;
            }

            if (iteration < maxIterations) {
                context.report("Subtask %d: refining with \"%s\"", subtask.getId(), nextQuery.get());
                query = ResearchPrompts.refinement(findings, verdict, nextQuery.get(), findingsPreviewLength);
            }
        }

        accept(subtask, lastFindings, lastVerdict, context,
                context.isCancelled() ? "cancelled, keeping last findings" : "iteration budget exhausted");
    }

    /**
     * The Critic's refined query if it gave one, else its first follow-up question.
     */
    static Optional<String> chooseNextQuery(Verdict verdict) {
        if (verdict.hasRefinedQuery()) {
            return Optional.of(verdict.refinedQuery());
        }
        return verdict.followUpQuestions().stream()
                .filter(q -> !q.isBlank())
                .findFirst();
    }

    private void accept(Subtask subtask, String findings, Verdict verdict, ResearchContext context, String reason) {
        subtask.complete(findings, verdict.qualityScore());
        log.info("Subtask {} complete ({}), score {}/10", subtask.getId(), reason, verdict.qualityScore());
        context.report("Subtask %d complete (%s), score %d/10", subtask.getId(), reason, verdict.qualityScore());
    }
}
