package com.eainde.research.task;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Agent types this worker can run.
 */
public enum AgentType {

    RESEARCH;

    /**
     * Case-insensitive lookup; empty for unknown or blank names.
     */
    public static Optional<AgentType> parse(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalized))
                .findFirst();
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
