package ai.foundrystack.backend.service.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pulls the first well-formed JSON object out of free-form model output.
 *
 * Tolerates markdown code fences, prose before and after the object, and trailing commas.
 * Candidates are tried in order: the contents of each fenced block, then the whole text; within
 * a candidate every balanced {...} span is tried from left to right.
 */
@Slf4j
@Component
public class JsonResponseExtractor {

    private static final String FENCE = "```";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();

    /**
     * @param rawText model output
     * @return the parsed object, keys in document order
     * @throws JsonExtractionException if no JSON object can be found
     */
    public Map<String, Object> extractObject(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new JsonExtractionException("Response is empty");
        }

        for (String candidate : candidates(rawText)) {
            Map<String, Object> parsed = firstObject(candidate);
            if (parsed != null) {
                return parsed;
            }
        }
        throw new JsonExtractionException("No JSON object found in response");
    }

    private List<String> candidates(String text) {
        List<String> candidates = new ArrayList<>();
        int searchFrom = 0;
        while (true) {
            int open = text.indexOf(FENCE, searchFrom);
            if (open < 0) {
                break;
            }
            int bodyStart = text.indexOf('\n', open + FENCE.length());
            int close = bodyStart < 0 ? -1 : text.indexOf(FENCE, bodyStart);
            if (close < 0) {
                // unterminated fence, keep what follows it
                candidates.add(text.substring(open + FENCE.length()));
                break;
            }
            candidates.add(text.substring(bodyStart + 1, close));
            searchFrom = close + FENCE.length();
        }
        candidates.add(text);
        return candidates;
    }

    private Map<String, Object> firstObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findObjectEnd(text, start);
            if (end > start) {
                try {
                    return objectMapper.readValue(text.substring(start, end + 1), MAP_TYPE);
                } catch (JsonProcessingException e) {
                    log.trace("Skipping unparseable span at offset {}: {}", start, e.getOriginalMessage());
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    /**
     * Index of the brace closing the object opened at {@code start}, or -1 if it is never closed.
     * Braces inside string literals are ignored.
     */
    private int findObjectEnd(String text, int start) {
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

    public static class JsonExtractionException extends RuntimeException {
        public JsonExtractionException(String message) {
            super(message);
        }
    }
}
