package com.eainde.research.engine;

/**
 * Turns a query into free-text findings. Whatever tools it uses are opaque to the engine.
 *
 * <p>Implementations must be safe to call from several sessions at once. Failures are
 * propagated to the caller of {@link IterativeResearchService#research} unchanged.</p>
 */
@FunctionalInterface
public interface Finder {

    String find(String query);
}
