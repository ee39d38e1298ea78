package com.eainde.research.engine;

import com.eainde.research.model.Verdict;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * User-prompt templates sent to the Finder and the Critic.
 * Role instructions live in the system prompts under {@code prompts/}.
 */
final class ResearchPrompts {

    static final String TRUNCATION_MARKER = "\n...[truncated]";

    private static final String DECOMPOSITION_TEMPLATE = """
            ## Research Query
            %s

            ---
            Decompose this query into 2-6 focused sub-tasks that can be researched one after another.
            Every sub-task needs:
            - "id": sequential integer starting at 1
            - "query": a specific query that works well with web search
            - "rationale": why this aspect needs investigation
            - "expectedOutcome": what information it should uncover
            - "dependsOn": ids of EARLIER sub-tasks whose findings it builds on (empty if none)

            Respond with this exact JSON structure:
            ```json
            {
                "isSatisfactory": false,
                "qualityScore": 0,
                "gaps": [],
                "followUpQuestions": [],
                "refinedQuery": null,
                "reasoning": "Decomposed into N sub-tasks for comprehensive coverage",
                "subTasks": [
                    {
                        "id": 1,
                        "query": "specific searchable query",
                        "rationale": "why this aspect needs investigation",
                        "dependsOn": [],
                        "expectedOutcome": "what information this should uncover"
                    }
                ]
            }
            ```
            """;

    private static final String EVALUATION_TEMPLATE = """
            ## Original Research Question
            %s

            ## Current Sub-task
            %s

            ## Expected Outcome
            %s

            ## Research Findings
            %s

            ---
            Please evaluate these findings and respond with your JSON assessment.
            """;

    private static final String REFINEMENT_TEMPLATE = """
            ## Refinement Needed
            Previous research on this topic scored %d/10.

            ### Evaluator Reasoning
            %s

            ### Identified Gaps
            %s

            ### Previous Findings (excerpt)
            %s

            ## Refined Query
            %s

            ---
            Build on the previous findings and concentrate on closing the gaps listed above.
            """;

    private static final String SYNTHESIS_TEMPLATE = """
            ## Original Question
            %s

            ## Research Findings (from %d completed sub-tasks)
            %s

            ---
            Synthesize these findings into a comprehensive, long-form, well-structured report that
            directly answers the original question. Integrate the sub-tasks instead of concatenating
            them, resolve contradictions, and keep every specific fact, figure, name and source:
            do not summarize detail away.
            Start with your JSON assessment, then write the COMPLETE report in markdown after it.
            """;

    private ResearchPrompts() {
    }

    static String decomposition(String query) {
        return String.format(Locale.ROOT, DECOMPOSITION_TEMPLATE, query);
    }

    static String evaluation(String originalQuery, String subtaskQuery, String expectedOutcome, String findings) {
        return String.format(Locale.ROOT, EVALUATION_TEMPLATE,
                originalQuery, subtaskQuery, blankToNone(expectedOutcome), findings);
    }

    static String refinement(String previousFindings, Verdict previous, String refinedQuery, int previewLength) {
        return String.format(Locale.ROOT, REFINEMENT_TEMPLATE,
                previous.qualityScore(),
                blankToNone(previous.reasoning()),
                bulletList(previous.gaps()),
                truncate(previousFindings, previewLength),
                refinedQuery);
    }

    static String synthesis(String originalQuery, int completedCount, String allFindings) {
        return String.format(Locale.ROOT, SYNTHESIS_TEMPLATE, originalQuery, completedCount, allFindings);
    }

    static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + TRUNCATION_MARKER;
    }

    private static String bulletList(List<String> items) {
        if (items.isEmpty()) {
            return "- None identified";
        }
        return items.stream().map(item -> "- " + item).collect(Collectors.joining("\n"));
    }

    private static String blankToNone(String value) {
        return value == null || value.isBlank() ? "(none given)" : value;
    }
}
