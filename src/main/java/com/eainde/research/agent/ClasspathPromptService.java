package com.eainde.research.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads system prompts from {@code <location>/<agentName>.system.txt} on the classpath.
 * Each prompt is read once and cached.
 */
public class ClasspathPromptService implements PromptService {

    private static final Logger log = LoggerFactory.getLogger(ClasspathPromptService.class);

    private final String location;
    private final Map<ResearchRole, String> cache = new ConcurrentHashMap<>();

    /**
     * @param location classpath folder, e.g. {@code prompts/}
     */
    public ClasspathPromptService(String location) {
        this.location = location.endsWith("/") ? location : location + "/";
    }

    @Override
    public String getSystemPrompt(ResearchRole role) {
        return cache.computeIfAbsent(role, this::load);
    }

    private String load(ResearchRole role) {
        String path = location + role.getAgentName() + ".system.txt";
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new IllegalStateException("System prompt not found on classpath: " + path);
        }
        try (InputStream in = resource.getInputStream()) {
            String prompt = StreamUtils.copyToString(in, StandardCharsets.UTF_8).strip();
            log.debug("Loaded system prompt for {} from {} ({} chars)", role, path, prompt.length());
            return prompt;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read system prompt " + path, e);
        }
    }
}
