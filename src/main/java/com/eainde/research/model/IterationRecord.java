package com.eainde.research.model;

import java.time.Instant;

/**
 * One Finder + Critic round, kept permanently in the session log whatever its outcome.
 *
 * @param iterationNumber 1-based, increasing across the whole session
 * @param subtaskId       subtask that produced the round, null for single-shot research
 * @param query           the query actually sent to the Finder
 * @param findings        the Finder's reply
 * @param evaluation      the parsed Critic verdict
 * @param timestamp       when the round was recorded
 */
public record IterationRecord(
        int iterationNumber,
        Integer subtaskId,
        String query,
        String findings,
        Verdict evaluation,
        Instant timestamp
) {}
