package com.production.pdf_analysis.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.production.pdf_analysis.exception.ResponseUnparseableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers one JSON object from raw model output. Steps, first success wins:
 * <ol>
 *   <li>parse as is</li>
 *   <li>the body of a fenced {@code ```json} block</li>
 *   <li>the first balanced {@code {...}} span</li>
 *   <li>strip comments and trailing commas, close unbalanced brackets, parse again</li>
 * </ol>
 */
@Component
@Slf4j
public class JsonRepairer {

    private static final Pattern FENCED_BLOCK =
            Pattern.compile("```(?:json|JSON)?\\s*(\\{[\\s\\S]*?\\})\\s*```");
    private static final TypeReference<Object> ANY = new TypeReference<>() {};
    private static final int PREVIEW_CHARS = 500;

    private final ObjectMapper objectMapper;

    public JsonRepairer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws ResponseUnparseableException when no step yields a JSON object
     */
    public Map<String, Object> repair(String content) {
        if (content == null || content.isBlank()) {
            throw new ResponseUnparseableException("Empty model response");
        }

        Optional<Map<String, Object>> parsed = parseObject(content.trim());
        if (parsed.isPresent()) {
            return parsed.get();
        }

        Matcher fenced = FENCED_BLOCK.matcher(content);
        if (fenced.find()) {
            parsed = parseObject(fenced.group(1));
            if (parsed.isPresent()) {
                log.debug("JSON recovered from fenced code block");
                return parsed.get();
            }
        }

        String span = firstBalancedObject(content);
        if (span != null) {
            parsed = parseObject(span);
            if (parsed.isPresent()) {
                log.debug("JSON recovered from first balanced object");
                return parsed.get();
            }
        }

        int start = content.indexOf('{');
        if (start >= 0) {
            String cleaned = clean(content.substring(start));
            parsed = parseObject(cleaned);
            if (parsed.isPresent()) {
                log.debug("JSON recovered after removing comments/trailing commas and closing brackets");
                return parsed.get();
            }
        }

        throw new ResponseUnparseableException("Failed to parse JSON from model response. Content preview: "
                + content.substring(0, Math.min(PREVIEW_CHARS, content.length())));
    }

    private Optional<Map<String, Object>> parseObject(String candidate) {
        try {
            Object value = objectMapper.readValue(candidate, ANY);
            Map<String, Object> map = LooseValues.asMap(value);
            return map == null ? Optional.empty() : Optional.of(new LinkedHashMap<>(map));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /**
     * The first {@code {...}} span whose braces balance, ignoring braces inside string literals.
     */
    static String firstBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
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
                        return text.substring(start, i + 1);
                    }
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    /**
     * Removes line and block comments and trailing commas outside string literals, then
     * appends whatever closers the open brackets still need.
     */
    static String clean(String text) {
        StringBuilder out = new StringBuilder(text.length() + 8);
        Deque<Character> open = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (inString) {
                out.append(c);
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                i++;
                continue;
            }
            if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
                continue;
            }
            if (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '*') {
                int end = text.indexOf("*/", i + 2);
                i = end < 0 ? text.length() : end + 2;
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{' -> open.push('}');
                case '[' -> open.push(']');
                case '}', ']' -> {
                    dropTrailingComma(out);
                    if (!open.isEmpty()) {
                        open.pop();
                    }
                }
                default -> {
                }
            }
            out.append(c);
            i++;
        }
        if (inString) {
            out.append('"');
        }
        while (!open.isEmpty()) {
            dropTrailingComma(out);
            out.append(open.pop());
        }
        return out.toString();
    }

    private static void dropTrailingComma(StringBuilder out) {
        int j = out.length() - 1;
        while (j >= 0 && Character.isWhitespace(out.charAt(j))) {
            j--;
        }
        if (j >= 0 && out.charAt(j) == ',') {
            out.deleteCharAt(j);
        }
    }
}
