package com.purchasingpower.ptcaudit.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Settings for call attribution, billing reconciliation and report rendering.
 *
 * <p>Properties are loaded from the {@code app.reconciliation} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   reconciliation:
 *     schema: refly
 *     ptc-call-id-prefix: "ptc:"
 *     credential-window: 1h
 *     non-billable-tools:
 *       - get_time
 *       - read_file
 * </pre>
 *
 * <p>Every value has a default so tests can build an instance with {@code new}
 * and override only what they exercise.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.reconciliation")
public class ReconciliationProperties {

    /**
     * Built-in tools that are intentionally free (no credit cost configured).
     */
    public static final List<String> DEFAULT_NON_BILLABLE_TOOLS = List.of(
            "get_time",
            "read_file",
            "list_files",
            "read_agent_result",
            "read_tool_result",
            "generate_doc",
            "generate_code_artifact",
            "execute_code");

    /**
     * Database schema holding the run, tool-call and billing tables.
     */
    @NotBlank
    @Pattern(regexp = "[A-Za-z_][A-Za-z0-9_]*", message = "Schema must be a plain SQL identifier")
    private String schema = "refly";

    /**
     * Call-id prefix that marks a pass-through call when the store has no
     * type column.
     */
    @NotBlank
    private String ptcCallIdPrefix = "ptc:";

    /**
     * How long before run start a temporary API key may have been created and
     * still count for the run.
     */
    @NotNull
    private Duration credentialWindow = Duration.ofHours(1);

    @NotNull
    private Set<String> nonBillableTools = new LinkedHashSet<>(DEFAULT_NON_BILLABLE_TOOLS);

    /**
     * Zone used to render timestamps, which are stored in UTC.
     */
    @NotNull
    private ZoneId displayZone = ZoneId.systemDefault();

    /**
     * Truncation limits applied by the text reports unless full output is requested.
     */
    private int titleDisplayLength = 50;
    private int promptDisplayLength = 200;
    private int callIdDisplayLength = 40;
    private int payloadDisplayLength = 1500;

    public boolean isNonBillable(String toolName) {
        return toolName != null && nonBillableTools.contains(toolName);
    }
}
