package com.purchasingpower.ptcaudit.model.run;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Identity and headline attributes of the run being reconciled.
 *
 * <p>{@code ptcEnabled} is null when the store predates the column.
 */
@Slf4j
@Value
@Builder
public class RunInfo {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String VARIABLES_PREFIX = "Variables:";

    String resultId;
    int version;
    String type;
    String modelName;
    String status;
    String title;
    String input;
    String ownerUid;
    LocalDateTime createdAt;
    Boolean ptcEnabled;

    public static RunInfo from(ActionResultEntity entity, Boolean ptcEnabled) {
        return RunInfo.builder()
                .resultId(entity.getResultId())
                .version(entity.getVersion())
                .type(entity.getType())
                .modelName(entity.getModelName())
                .status(entity.getStatus())
                .title(entity.getTitle())
                .input(entity.getInput())
                .ownerUid(entity.getUid())
                .createdAt(entity.getCreatedAt())
                .ptcEnabled(ptcEnabled)
                .build();
    }

    /**
     * User prompt of the run: the {@code query} field of the input JSON when
     * present, otherwise the title, with any leading variables block removed.
     */
    @JsonIgnore
    public String getPrompt() {
        String query = queryFromInput();
        if (query != null) {
            String prompt = stripVariablesBlock(query);
            if (prompt != null && !prompt.isEmpty()) {
                return prompt;
            }
        }
        return stripVariablesBlock(title);
    }

    private String queryFromInput() {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            JsonNode node = MAPPER.readTree(input);
            JsonNode query = node.path("query");
            return query.isTextual() ? query.asText() : null;
        } catch (Exception e) {
            log.debug("Run input is not JSON, falling back to title: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Titles of workflow runs start with a "Variables:" header followed by a
     * JSON array; only the free text after it is the prompt.
     */
    static String stripVariablesBlock(String text) {
        if (text == null || !text.strip().startsWith(VARIABLES_PREFIX)) {
            return text;
        }

        boolean inJson = false;
        boolean foundPrompt = false;
        List<String> promptLines = new ArrayList<>();

        for (String line : text.split("\n", -1)) {
            String stripped = line.strip();
            if (stripped.startsWith("[")) {
                inJson = true;
                continue;
            }
            if (inJson) {
                if (stripped.startsWith("]")) {
                    inJson = false;
                }
                continue;
            }
            if (!foundPrompt && stripped.isEmpty()) {
                continue;
            }
            if (stripped.startsWith(VARIABLES_PREFIX)) {
                continue;
            }
            if (!stripped.isEmpty()) {
                foundPrompt = true;
                promptLines.add(line);
            }
        }
        return promptLines.isEmpty() ? text : String.join("\n", promptLines).strip();
    }
}
