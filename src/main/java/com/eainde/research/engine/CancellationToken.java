package com.eainde.research.engine;

/**
 * Cooperative cancellation flag. The engine polls it before choosing the next subtask and
 * between refinement iterations; a Finder or Critic call already in flight is never interrupted.
 */
public final class CancellationToken {

    private volatile boolean cancellationRequested;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancellationRequested = true;
    }

    public boolean isCancellationRequested() {
        return cancellationRequested;
    }
}
