package com.eainde.research.parse;

import com.eainde.research.model.Verdict;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form Critic output into a {@link Verdict}.
 *
 * <h3>Extraction order (first success wins):</h3>
 * <ol>
 *   <li>a fenced block ({@code ```json ... ```}, tag optional)</li>
 *   <li>the first top-level JSON object, found with a brace-depth scan that ignores braces
 *       inside string literals</li>
 *   <li>the whole trimmed text when it is itself a {@code {...}} object</li>
 * </ol>
 *
 * <p>Never throws. When nothing usable is found the result is
 * {@link Verdict#defaultOptimistic()}, so a malformed reply cannot stall research.</p>
 *
 * <p>Keys are matched case-insensitively: the tree is rewritten to canonical key names
 * before binding.</p>
 */
public class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    private static final Pattern FENCED_BLOCK =
            Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)\\s*```", Pattern.CASE_INSENSITIVE);

    private static final Map<String, String> VERDICT_KEYS = canonicalKeys(
            "isSatisfactory", "qualityScore", "gaps", "followUpQuestions",
            "refinedQuery", "reasoning", "subtasks");

    private static final Map<String, String> SUBTASK_KEYS = canonicalKeys(
            "id", "query", "rationale", "dependsOn", "expectedOutcome");

    private final ObjectMapper objectMapper;
    private final ObjectReader treeReader;

    public ResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.treeReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    // =========================================================================
    //  Verdict
    // =========================================================================

    /**
     * Parses the first JSON object in {@code text} that binds to a verdict.
     *
     * @param text raw Critic reply, may be null
     * @return the parsed verdict, or the default-optimistic verdict
     */
    public Verdict parseVerdict(String text) {
        if (text == null || text.isBlank()) {
            log.warn("Empty evaluator response, using default verdict");
            return Verdict.defaultOptimistic();
        }

        for (JsonObjectMatch match : findJsonObjects(text)) {
            Optional<Verdict> verdict = bind(match.node());
            if (verdict.isPresent()) {
                return verdict.get();
            }
        }

        log.warn("No parseable verdict in evaluator response ({} chars), using default verdict",
                text.length());
        return Verdict.defaultOptimistic();
    }

    // =========================================================================
    //  Prose after a JSON preamble
    // =========================================================================

    /**
     * Returns the text that follows the first JSON object (or its closing fence).
     *
     * @param text     raw reply
     * @param fallback returned when the trailing text is blank
     * @return trailing prose, {@code text} unchanged when it holds no JSON object,
     *         or {@code fallback} when nothing follows the object
     */
    public String extractTrailingProse(String text, String fallback) {
        if (text == null) {
            return fallback;
        }
        List<JsonObjectMatch> matches = findJsonObjects(text);
        if (matches.isEmpty()) {
            return text;
        }
        String trailing = text.substring(matches.get(0).end()).trim();
        if (trailing.isEmpty()) {
            log.debug("Nothing follows the JSON preamble, using fallback");
            return fallback != null ? fallback : text;
        }
        return trailing;
    }

    // =========================================================================
    //  Locating JSON objects
    // =========================================================================

    /**
     * All JSON-object candidates, in strategy order. The end offset points just past the
     * object, or past the closing fence for fenced blocks.
     */
    List<JsonObjectMatch> findJsonObjects(String text) {
        List<JsonObjectMatch> matches = new ArrayList<>();

        Matcher fenced = FENCED_BLOCK.matcher(text);
        while (fenced.find()) {
            readObject(fenced.group(1))
                    .ifPresent(node -> matches.add(new JsonObjectMatch(node, fenced.end())));
        }

        findFirstTopLevelObject(text).ifPresent(matches::add);

        String trimmed = text.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            readObject(trimmed)
                    .ifPresent(node -> matches.add(new JsonObjectMatch(node, text.lastIndexOf('}') + 1)));
        }
        return matches;
    }

    /**
     * A balanced span that is not valid JSON is skipped as a whole, so an object nested
     * inside a malformed one is never mistaken for the top-level object.
     */
    private Optional<JsonObjectMatch> findFirstTopLevelObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findMatchingBrace(text, start);
            if (end < 0) {
                start = text.indexOf('{', start + 1);
                continue;
            }
            Optional<ObjectNode> node = readObject(text.substring(start, end + 1));
            if (node.isPresent()) {
                return Optional.of(new JsonObjectMatch(node.get(), end + 1));
            }
            start = text.indexOf('{', end + 1);
        }
        return Optional.empty();
    }

    /**
     * Index of the brace closing the one at {@code start}, or -1 if it is never closed.
     * Braces inside string literals, including escaped quotes, do not count.
     */
    static int findMatchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private Optional<ObjectNode> readObject(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = treeReader.readTree(json);
            return node != null && node.isObject() ? Optional.of((ObjectNode) node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Candidate is not valid JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    // =========================================================================
    //  Binding
    // =========================================================================

    private Optional<Verdict> bind(ObjectNode node) {
        ObjectNode canonical = canonicalize(node, VERDICT_KEYS);
        JsonNode subtasks = canonical.get("subtasks");
        if (subtasks != null && subtasks.isArray()) {
            ArrayNode normalized = objectMapper.createArrayNode();
            for (JsonNode subtask : subtasks) {
                normalized.add(subtask.isObject() ? canonicalize((ObjectNode) subtask, SUBTASK_KEYS) : subtask);
            }
            canonical.set("subtasks", normalized);
        }
        try {
            return Optional.ofNullable(objectMapper.treeToValue(canonical, Verdict.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("JSON object does not bind to a verdict: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private ObjectNode canonicalize(ObjectNode node, Map<String, String> canonicalByLowerCase) {
        ObjectNode result = objectMapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = canonicalByLowerCase.getOrDefault(field.getKey().toLowerCase(Locale.ROOT), field.getKey());
            if (!result.has(key)) {
                result.set(key, field.getValue());
            }
        }
        return result;
    }

    private static Map<String, String> canonicalKeys(String... keys) {
        Map<String, String> map = new HashMap<>();
        for (String key : keys) {
            map.put(key.toLowerCase(Locale.ROOT), key);
        }
        return Map.copyOf(map);
    }

    /**
     * A JSON object found in the text and the offset just past it.
     */
    record JsonObjectMatch(ObjectNode node, int end) {}
}
