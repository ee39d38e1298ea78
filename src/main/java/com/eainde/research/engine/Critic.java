package com.eainde.research.engine;

/**
 * Judges a prompt and answers in free text, usually a JSON verdict possibly wrapped in prose.
 * The engine uses one instance per mode (planning, evaluation, synthesis).
 */
@FunctionalInterface
public interface Critic {

    String evaluate(String prompt);
}
