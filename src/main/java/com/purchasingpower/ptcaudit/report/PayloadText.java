package com.purchasingpower.ptcaudit.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Extracts the readable parts of stored tool-call payloads for the calling trace.
 *
 * <p>Payloads are usually JSON but not always; text that does not parse as a
 * JSON object is shown as is.
 */
@Slf4j
final class PayloadText {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Input keys that best describe what a pass-through call was asked for, in
     * order of preference.
     */
    private static final List<String> SUMMARY_KEYS =
            List.of("symbol", "keywords", "query", "ticker", "name", "url", "topic");

    private static final int SUMMARY_VALUE_LIMIT = 50;

    private PayloadText() {
    }

    /**
     * Source code of an {@code execute_code} call: {@code code} of a nested
     * {@code input} object when present, otherwise the {@code code} or
     * {@code input} field, otherwise the whole input.
     */
    static String codeOf(String input) {
        JsonNode parsed = parseObject(input);
        if (parsed == null) {
            return input != null ? input : "";
        }
        JsonNode inner = parsed.path("input");
        if (inner.isTextual()) {
            JsonNode nested = parseObject(inner.asText());
            if (nested != null && nested.has("code")) {
                return text(nested.get("code"));
            }
        }
        for (String field : List.of("code", "input")) {
            JsonNode value = parsed.get(field);
            if (value != null && !value.isNull() && !text(value).isEmpty()) {
                return text(value);
            }
        }
        return parsed.toString();
    }

    /**
     * @return {@code language} field of the input, null when absent
     */
    static String languageOf(String input) {
        JsonNode parsed = parseObject(input);
        if (parsed == null) {
            return null;
        }
        JsonNode language = parsed.path("language");
        return language.isValueNode() && !language.asText().isEmpty() ? language.asText() : null;
    }

    /**
     * Short "(value)" hint for a pass-through call line, empty when nothing fits.
     */
    static String ptcSummary(String input) {
        JsonNode parsed = parseObject(input);
        if (parsed == null) {
            return "";
        }
        JsonNode inner = parsed.has("input") ? parsed.get("input") : parsed;
        if (inner.isTextual()) {
            inner = parseObject(inner.asText());
        }
        if (inner == null || !inner.isObject()) {
            return "";
        }
        for (String key : SUMMARY_KEYS) {
            if (inner.has(key)) {
                return "(" + text(inner.get(key)) + ")";
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = inner.fields();
        while (fields.hasNext()) {
            JsonNode value = fields.next().getValue();
            if (value.isTextual() && value.asText().length() < SUMMARY_VALUE_LIMIT) {
                return "(" + value.asText() + ")";
            }
        }
        return "";
    }

    /**
     * Stdout and a non-zero exit code of sandbox results, otherwise the output
     * as stored.
     */
    static String outputSummary(String output) {
        if (output == null || output.isEmpty()) {
            return "(empty output)";
        }
        JsonNode parsed = parseObject(output);
        if (parsed == null) {
            return output;
        }
        JsonNode data = parsed.has("data") ? parsed.get("data") : parsed;
        if (data.isObject()) {
            String stdout = firstNonEmpty(data, "output", "stdout");
            JsonNode exitCode = data.has("exitCode") ? data.get("exitCode") : data.get("exit_code");
            boolean hasExitCode = exitCode != null && !exitCode.isNull();
            if (!stdout.isEmpty() || hasExitCode) {
                StringBuilder summary = new StringBuilder(stdout.strip());
                if (hasExitCode && !(exitCode.isNumber() && exitCode.asInt() == 0)) {
                    if (summary.length() > 0) {
                        summary.append('\n');
                    }
                    summary.append("[exit=").append(text(exitCode)).append(']');
                }
                return summary.length() > 0 ? summary.toString() : "(empty output)";
            }
        }
        return parsed.toString();
    }

    /**
     * Tool name and status recorded in a message's {@code tool_call_meta}, or
     * null when the message is not about a tool call.
     */
    static ToolCallMeta toolCallMeta(String meta) {
        JsonNode parsed = parseObject(meta);
        if (parsed == null || text(parsed.path("toolName")).isEmpty()) {
            return null;
        }
        return new ToolCallMeta(text(parsed.get("toolName")), text(parsed.path("status")));
    }

    record ToolCallMeta(String toolName, String status) {
    }

    private static JsonNode parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(raw);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.trace("Payload is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String firstNonEmpty(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node.path(field));
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
