package com.eainde.research.engine;

/**
 * Receives human-readable progress messages at phase boundaries. Fire-and-forget.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(String message);
}
