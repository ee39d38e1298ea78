package com.eainde.research.engine;

import com.eainde.research.model.ResearchPlan;
import com.eainde.research.model.Subtask;
import com.eainde.research.parse.ResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Combines the findings of completed subtasks into the final deliverable.
 *
 * <ul>
 *   <li>nothing completed: fixed message, no Critic call</li>
 *   <li>one completed: its findings verbatim, no Critic call</li>
 *   <li>two or more: the synthesis Critic writes the report; any JSON preamble is stripped</li>
 * </ul>
 */
public class ResearchSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ResearchSynthesizer.class);

    public static final String NOTHING_COMPLETED =
            "No sub-tasks were completed, so there are no findings to synthesize.";

    private final Critic synthesisCritic;
    private final ResponseParser responseParser;
    private final double contentLossRatio;
    private final int contentLossMinBytes;

    /**
     * @param contentLossRatio    extracted/raw size ratio below which loss is suspected (e.g. 0.5)
     * @param contentLossMinBytes raw responses at or below this size are never flagged
     */
    public ResearchSynthesizer(Critic synthesisCritic,
                               ResponseParser responseParser,
                               double contentLossRatio,
                               int contentLossMinBytes) {
        this.synthesisCritic = synthesisCritic;
        this.responseParser = responseParser;
        this.contentLossRatio = contentLossRatio;
        this.contentLossMinBytes = contentLossMinBytes;
    }

    public String synthesize(ResearchPlan plan) {
        List<Subtask> completed = plan.getCompletedSubtasks();

        if (completed.isEmpty()) {
            return NOTHING_COMPLETED;
        }
        if (completed.size() == 1) {
            return completed.get(0).getFindings();
        }

        String aggregate = plan.getAllFindings();
        String raw = synthesisCritic.evaluate(
                ResearchPrompts.synthesis(plan.getOriginalQuery(), completed.size(), aggregate));

        if (raw == null || raw.isBlank()) {
            log.warn("Synthesis returned no content, using concatenated sub-task findings");
            return aggregate;
        }

        String report = responseParser.extractTrailingProse(raw, aggregate);
        checkContentLoss(raw, report);
        return report;
    }

    /**
     * Diagnostic only: warns when prose extraction kept suspiciously little of a large reply.
     */
    boolean checkContentLoss(String raw, String extracted) {
        int rawBytes = raw.getBytes(StandardCharsets.UTF_8).length;
        int extractedBytes = extracted.getBytes(StandardCharsets.UTF_8).length;

        boolean suspicious = rawBytes > contentLossMinBytes && extractedBytes < rawBytes * contentLossRatio;
        if (suspicious) {
            log.warn("Possible content loss in synthesis: extracted {} of {} bytes ({}%)",
                    extractedBytes, rawBytes, Math.round(100.0 * extractedBytes / rawBytes));
        } else {
            log.debug("Synthesis extracted {} of {} bytes", extractedBytes, rawBytes);
        }
        return suspicious;
    }
}
