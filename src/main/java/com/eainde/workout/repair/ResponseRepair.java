package com.eainde.workout.repair;

import com.eainde.workout.error.MalformedResponseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns raw model output into trusted JSON.
 *
 * <p>The stages are applied by {@link #parseTrustedJson(String)} in this order:</p>
 * <ol>
 *   <li>{@link #fixDoubleEncodedJson(String)}: unwrap a response that is one big quoted JSON string</li>
 *   <li>{@link #stripNonJson(String)}: drop prose before the first bracket and after the last one</li>
 *   <li>{@link #cleanResponse(String)}: remove markdown fences, then extract the bracketed body again</li>
 *   <li>{@link #fixMalformedJson(String)}: trailing commas, truncated output, excess closing braces</li>
 *   <li>{@link #fixDoubleEncodedProperties(JsonNode)}: parse string properties that hold JSON</li>
 * </ol>
 * Every stage is usable on its own.
 */
@Slf4j
public final class ResponseRepair {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");
    private static final Pattern FENCE_WITH_LANGUAGE = Pattern.compile("```json", Pattern.CASE_INSENSITIVE);

    private ResponseRepair() {
    }

    // =========================================================================
    //  Pipeline
    // =========================================================================

    /**
     * Runs every repair stage and returns a parsed value.
     *
     * @throws MalformedResponseException if nothing parseable could be recovered
     */
    public static JsonNode parseTrustedJson(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedResponseException("Model returned an empty response");
        }

        // A fully quoted payload must be unwrapped before bracket extraction cuts its quotes off
        String unwrapped = fixDoubleEncodedJson(raw.trim());
        String stripped = stripNonJson(unwrapped);
        String cleaned = cleanResponse(stripped);
        String fixed = fixMalformedJson(cleaned);

        JsonNode parsed = readStrict(fixDoubleEncodedJson(fixed));
        if (parsed.isTextual() && looksLikeJson(parsed.asText())) {
            parsed = readStrict(fixMalformedJson(parsed.asText().trim()));
        }
        return fixDoubleEncodedProperties(parsed);
    }

    /**
     * Same as {@link #parseTrustedJson(String)} but insists on a JSON object at the root.
     */
    public static ObjectNode parseTrustedObject(String raw) {
        JsonNode node = parseTrustedJson(raw);
        if (!node.isObject()) {
            throw new MalformedResponseException("Expected a JSON object but got " + node.getNodeType());
        }
        return (ObjectNode) node;
    }

    // =========================================================================
    //  Stage 1: stripNonJson
    // =========================================================================

    /**
     * Keeps only the text between the first opening bracket and the last closing bracket.
     * Returns the trimmed input unchanged when no bracket pair is present.
     */
    public static String stripNonJson(String response) {
        if (response == null) {
            return "";
        }
        String cleaned = response.trim();

        int firstBrace = cleaned.indexOf('{');
        int firstBracket = cleaned.indexOf('[');
        int start;
        if (firstBrace != -1 && firstBracket != -1) {
            start = Math.min(firstBrace, firstBracket);
        } else {
            start = Math.max(firstBrace, firstBracket);
        }
        if (start == -1) {
            return cleaned;
        }

        int end = Math.max(cleaned.lastIndexOf('}'), cleaned.lastIndexOf(']'));
        if (end == -1 || end < start) {
            // Truncated output: keep everything from the opener on
            return cleaned.substring(start);
        }
        return cleaned.substring(start, end + 1);
    }

    // =========================================================================
    //  Stage 2: cleanResponse
    // =========================================================================

    /**
     * Removes markdown code fences and re-extracts the JSON body, so fences that leave
     * prose around the payload are handled too.
     */
    public static String cleanResponse(String response) {
        if (response == null) {
            return "";
        }
        String cleaned = FENCE_WITH_LANGUAGE.matcher(response).replaceAll("");
        cleaned = cleaned.replace("```", "").trim();

        if (cleaned.startsWith("[")) {
            int last = cleaned.lastIndexOf(']');
            if (last > 0) {
                return cleaned.substring(0, last + 1);
            }
        } else if (cleaned.startsWith("{")) {
            int last = cleaned.lastIndexOf('}');
            if (last > 0) {
                return cleaned.substring(0, last + 1);
            }
        } else {
            return stripNonJson(cleaned);
        }
        return cleaned;
    }

    // =========================================================================
    //  Stage 3: fixMalformedJson
    // =========================================================================

    /**
     * Repairs the structural problems models actually produce.
     * The first candidate that parses wins.
     *
     * @return a string that parses as JSON
     * @throws MalformedResponseException when no repair produced parseable JSON
     */
    public static String fixMalformedJson(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedResponseException("Unable to fix malformed JSON: input is empty");
        }
        if (parses(json)) {
            return json;
        }

        String fixed = TRAILING_COMMA.matcher(json.trim()).replaceAll("$1");
        if (parses(fixed)) {
            log.debug("Repaired JSON by removing trailing commas");
            return fixed;
        }

        BracketScan scan = BracketScan.of(fixed);

        if (scan.excessClosers == 0) {
            String closed = closeOpenStructures(fixed, scan);
            if (parses(closed)) {
                log.debug("Repaired truncated JSON by appending {} closers", scan.open.size());
                return closed;
            }
        } else {
            String collapsed = collapseDuplicateClosers(fixed);
            if (collapsed != null && parses(collapsed)) {
                log.debug("Repaired JSON by collapsing duplicate closers");
                return collapsed;
            }

            String trimmedFromEnd = trimExcessFromEnd(fixed, scan.excessClosers);
            if (parses(trimmedFromEnd)) {
                log.debug("Repaired JSON by trimming {} excess closers from the end", scan.excessClosers);
                return trimmedFromEnd;
            }

            String unmatchedRemoved = scan.withoutUnmatchedClosers(fixed);
            if (parses(unmatchedRemoved)) {
                log.debug("Repaired JSON by removing {} unmatched closers", scan.excessClosers);
                return unmatchedRemoved;
            }
        }

        throw new MalformedResponseException("Unable to fix malformed JSON after all repair attempts");
    }

    /**
     * Collapses runs of identical closers into one and trims what is still in excess.
     * Returns null when the collapse removed closers the document needed.
     */
    private static String collapseDuplicateClosers(String json) {
        String collapsed = collapseOutsideStrings(json);
        BracketScan rescan = BracketScan.of(collapsed);
        if (!rescan.open.isEmpty()) {
            return null;
        }
        return rescan.excessClosers > 0 ? trimExcessFromEnd(collapsed, rescan.excessClosers) : collapsed;
    }

    private static String collapseOutsideStrings(String json) {
        StringBuilder sb = new StringBuilder(json.length());
        boolean inString = false;
        boolean escaped = false;
        char previous = 0;
        for (int i = 0; i < json.length(); i++) {
            char c = json.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                sb.append(c);
                previous = 0;
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if ((c == '}' || c == ']') && c == previous) {
                continue;
            }
            sb.append(c);
            previous = c;
        }
        return sb.toString();
    }

    private static String trimExcessFromEnd(String json, int excess) {
        StringBuilder sb = new StringBuilder(json);
        int removed = 0;
        for (int i = sb.length() - 1; i >= 0 && removed < excess; i--) {
            char c = sb.charAt(i);
            if (c == '}' || c == ']') {
                sb.deleteCharAt(i);
                removed++;
            } else if (!Character.isWhitespace(c)) {
                break;
            }
        }
        return sb.toString();
    }

    private static String closeOpenStructures(String json, BracketScan scan) {
        StringBuilder sb = new StringBuilder(json.trim());
        if (scan.inString) {
            sb.append('"');
        }
        // A value cut after a separator cannot be completed; drop the separator
        while (sb.length() > 0 && (sb.charAt(sb.length() - 1) == ',' || sb.charAt(sb.length() - 1) == ':')) {
            sb.setLength(sb.length() - 1);
        }
        Iterator<Character> openers = scan.open.iterator();
        while (openers.hasNext()) {
            sb.append(openers.next() == '{' ? '}' : ']');
        }
        return sb.toString();
    }

    // =========================================================================
    //  Stage 4: fixDoubleEncodedJson
    // =========================================================================

    /**
     * Unwraps one level of string encoding when the whole payload is a quoted JSON document,
     * e.g. {@code "{\"a\":1}"}. Anything else is returned trimmed and untouched.
     */
    public static String fixDoubleEncodedJson(String json) {
        if (json == null) {
            return "";
        }
        String trimmed = json.trim();
        if (trimmed.length() < 2 || !trimmed.startsWith("\"") || !trimmed.endsWith("\"")) {
            return trimmed;
        }
        try {
            JsonNode decoded = objectMapper.readTree(trimmed);
            if (decoded.isTextual() && looksLikeJson(decoded.asText())) {
                log.warn("Unwrapped double-encoded JSON response");
                return decoded.asText().trim();
            }
        } catch (JsonProcessingException e) {
            log.debug("Quoted response is not a JSON string literal: {}", e.getOriginalMessage());
        }
        return trimmed;
    }

    // =========================================================================
    //  Stage 5: fixDoubleEncodedProperties
    // =========================================================================

    /**
     * Recursively replaces string values that contain JSON with the parsed value.
     * Returns a new tree; the argument is not modified. Applying it twice is the same as once.
     */
    public static JsonNode fixDoubleEncodedProperties(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            String text = node.asText().trim();
            if (looksLikeJson(text)) {
                try {
                    JsonNode parsed = objectMapper.readTree(text);
                    log.debug("Fixed double-encoded property");
                    return fixDoubleEncodedProperties(parsed);
                } catch (JsonProcessingException e) {
                    return node;
                }
            }
            return node;
        }
        if (node.isObject()) {
            ObjectNode fixed = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                fixed.set(field.getKey(), fixDoubleEncodedProperties(field.getValue()));
            }
            return fixed;
        }
        if (node.isArray()) {
            ArrayNode fixed = JsonNodeFactory.instance.arrayNode();
            node.forEach(item -> fixed.add(fixDoubleEncodedProperties(item)));
            return fixed;
        }
        return node;
    }

    /**
     * Object-typed convenience for candidates, which are always objects.
     */
    public static ObjectNode fixDoubleEncodedProperties(ObjectNode node) {
        return (ObjectNode) fixDoubleEncodedProperties((JsonNode) node);
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private static boolean looksLikeJson(String text) {
        return text.startsWith("{") || text.startsWith("[");
    }

    private static boolean parses(String json) {
        try {
            objectMapper.readTree(json);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private static JsonNode readStrict(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Single string-aware pass over the text: the structures left open at the end,
     * and the closers that had nothing to close.
     */
    private static final class BracketScan {
        private final Deque<Character> open = new ArrayDeque<>();
        private final boolean[] unmatched;
        private int excessClosers;
        private boolean inString;

        private BracketScan(int length) {
            this.unmatched = new boolean[length];
        }

        static BracketScan of(String json) {
            BracketScan scan = new BracketScan(json.length());
            boolean escaped = false;
            for (int i = 0; i < json.length(); i++) {
                char c = json.charAt(i);
                if (scan.inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        scan.inString = false;
                    }
                    continue;
                }
                switch (c) {
                    case '"' -> scan.inString = true;
                    case '{', '[' -> scan.open.push(c);
                    case '}', ']' -> {
                        char expected = c == '}' ? '{' : '[';
                        if (!scan.open.isEmpty() && scan.open.peek() == expected) {
                            scan.open.pop();
                        } else {
                            scan.unmatched[i] = true;
                            scan.excessClosers++;
                        }
                    }
                    default -> {
                        // not structural
                    }
                }
            }
            return scan;
        }

        String withoutUnmatchedClosers(String json) {
            StringBuilder sb = new StringBuilder(json.length());
            for (int i = 0; i < json.length(); i++) {
                if (!unmatched[i]) {
                    sb.append(json.charAt(i));
                }
            }
            return sb.toString();
        }
    }
}
