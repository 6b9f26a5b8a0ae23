package com.purchasingpower.ptcaudit.report;

import com.purchasingpower.ptcaudit.config.ReconciliationProperties;
import com.purchasingpower.ptcaudit.model.billing.BillingAnomaly;
import com.purchasingpower.ptcaudit.model.billing.BillingSummary;
import com.purchasingpower.ptcaudit.model.billing.CallBilling;
import com.purchasingpower.ptcaudit.model.billing.ToolsetBreakdownRow;
import com.purchasingpower.ptcaudit.model.billing.UsageTotals;
import com.purchasingpower.ptcaudit.model.call.AttributedCall;
import com.purchasingpower.ptcaudit.model.call.CallRecord;
import com.purchasingpower.ptcaudit.model.call.CallStatus;
import com.purchasingpower.ptcaudit.model.call.CallTree;
import com.purchasingpower.ptcaudit.model.call.ClassifiedCall;
import com.purchasingpower.ptcaudit.model.calling.CallPayload;
import com.purchasingpower.ptcaudit.model.calling.CallingDetails;
import com.purchasingpower.ptcaudit.model.calling.ConversationMessage;
import com.purchasingpower.ptcaudit.model.dto.ReconciliationReport;
import com.purchasingpower.ptcaudit.model.run.RunInfo;
import com.purchasingpower.ptcaudit.model.verification.CheckOutcome;
import com.purchasingpower.ptcaudit.model.verification.CheckResult;
import com.purchasingpower.ptcaudit.model.verification.CredentialRecord;
import com.purchasingpower.ptcaudit.model.verification.VerificationReport;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a {@link ReconciliationReport} as the plain-text verify report,
 * billing trace or calling trace.
 *
 * <p>Timestamps are stored in UTC and shown in the configured display zone.
 * Unless {@code full} is set, title, prompt and call ids are truncated.
 */
@Component
@RequiredArgsConstructor
public class ReconciliationReportFormatter {

    static final String SEPARATOR = "═".repeat(62);
    static final String DIVIDER = "  " + "─".repeat(58);
    static final String UNBILLED_FLAG = "  ← ⚠️ UNBILLED";
    static final String BLOCK_RULE = "-".repeat(100);
    static final String CODE_TOOL = "execute_code";

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ReconciliationProperties properties;

    public String render(ReconciliationReport report, ReportMode mode, boolean full) {
        return switch (mode) {
            case VERIFY -> renderVerify(report, full);
            case BILLING -> renderBillingTrace(report, full);
            case CALLING -> renderCalling(report, full);
        };
    }

    /**
     * Billing timeline, consolidated checks and the final result line.
     */
    public String renderVerify(ReconciliationReport report, boolean full) {
        StringBuilder out = new StringBuilder();
        header(out, "PTC VERIFY", report.getRun());
        resultInfo(out, report.getRun(), full);

        Set<String> unbilled = unbilledIds(report.getBilling());
        CallTree tree = report.getCallTree();
        out.append(String.format("[2] BILLING TIMELINE  (%d agent + %d ptc)%n%n", tree.getAgentCount(), tree.getPtcCount()));
        callTimeline(out, report, unbilled, false);

        checks(out, report, full);
        out.append(SEPARATOR).append("\n\n");
        return out.toString();
    }

    /**
     * Per-call credits with inline totals, then warnings and, in full mode, the
     * per-toolset breakdown.
     */
    public String renderBillingTrace(ReconciliationReport report, boolean full) {
        StringBuilder out = new StringBuilder();
        header(out, "PTC DEBUG BILLING", report.getRun());
        resultInfo(out, report.getRun(), full);

        CallTree tree = report.getCallTree();
        out.append(String.format("[2] BILLING TRACE  (%d agent + %d ptc)%n%n", tree.getAgentCount(), tree.getPtcCount()));
        callTimeline(out, report, Set.of(), full);
        totals(out, report.getBilling());

        int section = 3;
        if (report.getBilling().hasAnomalies()) {
            warnings(out, report.getBilling().getAnomalies(), section++, full);
        }
        if (full && !report.getToolsetBreakdown().isEmpty()) {
            breakdown(out, report.getToolsetBreakdown(), section);
        }
        out.append(SEPARATOR).append("\n\n");
        return out.toString();
    }

    /**
     * Conversation, then every agent call with its input, output and error and
     * the pass-through calls it made. Payloads are cut at
     * {@code payloadDisplayLength} unless {@code full} is set, which also
     * prints pass-through payloads.
     */
    public String renderCalling(ReconciliationReport report, boolean full) {
        CallingDetails calling = report.getCalling() != null ? report.getCalling() : CallingDetails.empty();

        StringBuilder out = new StringBuilder();
        header(out, "PTC DEBUG CALLING", report.getRun());
        resultInfo(out, report.getRun(), full);
        conversation(out, calling, full);

        CallTree tree = report.getCallTree();
        out.append(String.format("[3] TOOL CALLS TIMELINE (%d agent + %d ptc)%n%n", tree.getAgentCount(), tree.getPtcCount()));
        for (AttributedCall agent : tree.getAgentCalls()) {
            agentPayloads(out, agent.getAgentCall().getRecord(), calling, full);
            for (ClassifiedCall ptc : agent.getChildren()) {
                out.append("    └─ ").append(ptcCallingLine(ptc.getRecord(), calling)).append('\n');
                if (full) {
                    ptcPayloads(out, calling.payloadOf(ptc.getCallId()));
                }
            }
            out.append('\n');
        }
        ptcCallingSection(out, "[Orphan PTC calls — parent not found]", tree.getOrphans(), calling);
        ptcCallingSection(out, "[Unattributed PTC calls — no agent call in run]", tree.getUnattributedCalls(), calling);

        out.append(SEPARATOR).append("\n\n");
        return out.toString();
    }

    // ================================================================
    // SECTIONS
    // ================================================================

    private void header(StringBuilder out, String title, RunInfo run) {
        out.append('\n').append(SEPARATOR).append('\n');
        out.append(' ').append(title).append(": ").append(run.getResultId()).append('\n');
        out.append(SEPARATOR).append("\n\n");
    }

    private void resultInfo(StringBuilder out, RunInfo run, boolean full) {
        out.append("[1] RESULT INFO\n");
        out.append("  Result ID: ").append(run.getResultId()).append('\n');
        out.append("  Version:   ").append(run.getVersion()).append('\n');
        out.append("  Model:     ").append(run.getModelName()).append('\n');
        out.append("  Status:    ").append(run.getStatus()).append('\n');
        if (run.getPtcEnabled() != null) {
            out.append("  PTC:       ").append(run.getPtcEnabled() ? "true" : "false").append('\n');
        }
        out.append("  Title:     ").append(truncate(run.getTitle(), properties.getTitleDisplayLength(), full)).append('\n');
        out.append("  Prompt:    ").append(truncate(run.getPrompt(), properties.getPromptDisplayLength(), full)).append('\n');
        out.append("  Created:   ").append(formatDateTime(run.getCreatedAt())).append("\n\n");
    }

    private void callTimeline(StringBuilder out, ReconciliationReport report, Set<String> unbilled, boolean full) {
        BillingSummary billing = report.getBilling();
        CallTree tree = report.getCallTree();

        for (AttributedCall agent : tree.getAgentCalls()) {
            out.append(agentLine(agent.getAgentCall().getRecord(), billing, unbilled)).append('\n');
            for (ClassifiedCall ptc : agent.getChildren()) {
                out.append(ptcLine(ptc.getRecord(), billing, unbilled)).append('\n');
                if (full) {
                    CallBilling callBilling = billing.billingOf(ptc.getCallId());
                    callBilling.getDurationIfKnown().ifPresent(d ->
                            out.append("       Duration: ").append(formatDuration(d)).append('\n'));
                    out.append("       Call ID:  ").append(shortCallId(ptc.getCallId())).append('\n');
                }
            }
            out.append('\n');
        }

        ptcSection(out, "[Orphan PTC — parent not found]", tree.getOrphans(), billing, unbilled);
        ptcSection(out, "[Unattributed PTC — no agent call in run]", tree.getUnattributedCalls(), billing, unbilled);
    }

    private void ptcSection(StringBuilder out, String title, List<ClassifiedCall> calls,
                            BillingSummary billing, Set<String> unbilled) {
        if (calls.isEmpty()) {
            return;
        }
        out.append("  ").append(title).append(" (").append(calls.size()).append(")\n");
        for (ClassifiedCall ptc : calls) {
            out.append(ptcLine(ptc.getRecord(), billing, unbilled));
            if (ptc.getRecord().hasExplicitParent()) {
                out.append("  (parent: ").append(ptc.getRecord().getExplicitParentId()).append(')');
            }
            out.append('\n');
        }
        out.append('\n');
    }

    private void totals(StringBuilder out, BillingSummary billing) {
        UsageTotals usage = billing.getUsage();
        out.append(DIVIDER).append('\n');
        out.append(String.format("  Tools:  %8s credits  (agent: %s | ptc: %s)%n",
                amount(usage.getToolCredits()), amount(billing.getAgentCredits()), amount(billing.getPtcCredits())));
        out.append(String.format("  Model:  %8s credits%n", amount(usage.getModelCredits())));
        if (billing.getDiscountIfAny().isPresent()) {
            out.append(String.format("  Total:  %8s credits  (original: %s, discount: %s)%n",
                    amount(usage.getTotalCredits()), amount(usage.getOriginalPriceTotal()),
                    amount(billing.getDiscount())));
        } else {
            out.append(String.format("  Total:  %8s credits%n", amount(usage.getTotalCredits())));
        }
        out.append(DIVIDER).append("\n\n");
    }

    private void warnings(StringBuilder out, List<BillingAnomaly> anomalies, int section, boolean full) {
        out.append(String.format("[%d] ⚠️  BILLING WARNINGS (%d issue%s)%n%n",
                section, anomalies.size(), anomalies.size() != 1 ? "s" : ""));
        out.append("  The following tool calls completed successfully but were NOT billed:\n\n");
        for (BillingAnomaly anomaly : anomalies) {
            out.append("  ⚠️  [").append(orUnknown(anomaly.getToolset())).append("] ").append(anomaly.getToolName()).append('\n');
            out.append("     Time: ").append(formatTime(anomaly.getTimestamp())).append('\n');
            if (full) {
                out.append("     Call ID: ").append(shortCallId(anomaly.getCallId())).append('\n');
            }
            out.append("     Reason: Successful execution but 0 credits charged\n");
            out.append("     → Check if tool is configured for billing (isGlobal=true)\n\n");
        }
    }

    private void breakdown(StringBuilder out, List<ToolsetBreakdownRow> rows, int section) {
        out.append(String.format("[%d] DETAILED BREAKDOWN BY TOOLSET%n%n", section));
        int toolsetWidth = rows.stream().mapToInt(r -> orUnknown(r.getToolset()).length()).max().orElse(7);
        int toolWidth = rows.stream().mapToInt(r -> orUnknown(r.getToolName()).length()).max().orElse(4);
        toolsetWidth = Math.max(toolsetWidth, "Toolset".length());
        toolWidth = Math.max(toolWidth, "Tool".length());

        String rowFormat = "  %-" + toolsetWidth + "s  %-" + toolWidth + "s  %-6s  %6s  %7s  %8s  %8s%n";
        out.append(String.format(rowFormat, "Toolset", "Tool", "Type", "Calls", "Success", "Credits", "Original"));
        out.append(String.format(rowFormat, "-".repeat(toolsetWidth), "-".repeat(toolWidth), "-".repeat(6),
                "-".repeat(6), "-".repeat(7), "-".repeat(8), "-".repeat(8)));
        for (ToolsetBreakdownRow row : rows) {
            out.append(String.format(rowFormat, orUnknown(row.getToolset()), orUnknown(row.getToolName()),
                    orUnknown(row.getCallType()), row.getCalls(), row.getSuccessCount(),
                    amount(row.getTotalCredits()), amount(row.getOriginalPrice())));
        }
        out.append('\n');
    }

    private void checks(StringBuilder out, ReconciliationReport report, boolean full) {
        VerificationReport verification = report.getVerification();
        out.append("[3] CHECKS\n\n");

        for (CheckResult check : verification.getChecks()) {
            out.append("  ").append(check.getSource()).append(":\n");
            out.append("    ").append(icon(check.getOutcome())).append(' ').append(check.getMessage());
            if (check.getOutcome() == CheckOutcome.PASSED && "user_api_keys".equals(check.getSource())) {
                CredentialRecord key = report.getFacts().getLatestCredential();
                out.append(String.format("  (created: %s, expires: %s)",
                        formatTime(key.getCreatedAt()), formatDateTime(key.getExpiresAt())));
            }
            out.append('\n');
            if (check.getOutcome() == CheckOutcome.FAILED && "billing".equals(check.getSource())) {
                for (BillingAnomaly anomaly : report.getBilling().getAnomalies()) {
                    out.append("    ⚠ [").append(orUnknown(anomaly.getToolset())).append("] ")
                            .append(anomaly.getToolName()).append("  @ ").append(formatTime(anomaly.getTimestamp())).append('\n');
                    if (full) {
                        out.append("      CallID: ").append(shortCallId(anomaly.getCallId())).append('\n');
                    }
                    out.append("      Reason: Completed but 0 credits charged\n");
                    out.append("      Fix:    Ensure tool has isGlobal=true and billing is configured\n");
                }
            }
            out.append('\n');
        }

        List<String> issues = verification.getIssueDetails();
        out.append(DIVIDER).append('\n');
        if (issues.isEmpty()) {
            out.append("  Result: ✓ All checks passed\n");
        } else {
            out.append(String.format("  Result: ✗ %d issue%s found: %s%n",
                    issues.size(), issues.size() > 1 ? "s" : "", String.join(", ", issues)));
        }
        out.append(DIVIDER).append("\n\n");
    }

    private void conversation(StringBuilder out, CallingDetails calling, boolean full) {
        String counts = calling.getMessageTypeCounts().entrySet().stream()
                .map(e -> e.getValue() + " " + e.getKey())
                .collect(Collectors.joining(", "));
        out.append("[2] CONVERSATION (").append(counts.isEmpty() ? "no messages" : counts).append(")\n");

        for (ConversationMessage message : calling.getMessages()) {
            String label = message.getType() != null ? message.getType().toUpperCase(Locale.ROOT) : "UNKNOWN";
            PayloadText.ToolCallMeta meta = PayloadText.toolCallMeta(message.getToolCallMeta());
            out.append("  --- ").append(label)
                    .append(" (").append(message.getMessageId() != null ? message.getMessageId() : "?").append(')')
                    .append(" @ ").append(formatTime(message.getCreatedAt()));
            if (meta != null) {
                out.append(" [").append(meta.toolName()).append(' ')
                        .append(statusIcon(CallStatus.forDisplay(meta.status()))).append(']');
            }
            out.append(" ---\n");
            if (message.getContent() != null && !message.getContent().isEmpty()) {
                for (String line : truncate(message.getContent(), properties.getPayloadDisplayLength(), full).split("\n", -1)) {
                    out.append("  ").append(line).append('\n');
                }
            }
            out.append('\n');
        }
    }

    private void agentPayloads(StringBuilder out, CallRecord call, CallingDetails calling, boolean full) {
        CallPayload payload = calling.payloadOf(call.getCallId());
        out.append("  [Agent] ").append(call.getToolName())
                .append(" @ ").append(formatTime(call.getCreatedAt()))
                .append(" (").append(call.getStatus()).append(") ")
                .append(statusIcon(CallStatus.forDisplay(call.getStatus()))).append('\n');

        if (CODE_TOOL.equals(call.getToolName())) {
            out.append("    Code: ").append(block(PayloadText.codeOf(payload.getInput()), full)).append('\n');
            String language = PayloadText.languageOf(payload.getInput());
            if (language != null) {
                out.append("    Lang: ").append(language).append('\n');
            }
        } else if (payload.getInput() != null && !payload.getInput().isBlank()) {
            out.append("    Input: ").append(truncate(payload.getInput(), properties.getPayloadDisplayLength(), full)).append('\n');
        }

        out.append("    Output: ").append(block(PayloadText.outputSummary(payload.getOutput()), full)).append('\n');
        if (payload.hasError()) {
            out.append("    Error: ").append(block(payload.getError(), full)).append('\n');
        }
    }

    private void ptcPayloads(StringBuilder out, CallPayload payload) {
        if (payload.getInput() != null && !payload.getInput().isEmpty()) {
            out.append("       Input: ").append(payload.getInput()).append('\n');
        }
        if (payload.getOutput() != null && !payload.getOutput().isEmpty()) {
            out.append("       Output: ").append(payload.getOutput().strip()).append('\n');
        }
        if (payload.hasError()) {
            out.append("       Error: ").append(payload.getError()).append('\n');
        }
    }

    private void ptcCallingSection(StringBuilder out, String title, List<ClassifiedCall> calls, CallingDetails calling) {
        if (calls.isEmpty()) {
            return;
        }
        out.append("  ").append(title).append(" (").append(calls.size()).append(")\n");
        for (ClassifiedCall ptc : calls) {
            out.append("    └─ ").append(ptcCallingLine(ptc.getRecord(), calling));
            if (ptc.getRecord().hasExplicitParent()) {
                out.append("  (parent: ").append(ptc.getRecord().getExplicitParentId()).append(')');
            }
            out.append('\n');
        }
        out.append('\n');
    }

    private String ptcCallingLine(CallRecord call, CallingDetails calling) {
        String summary = PayloadText.ptcSummary(calling.payloadOf(call.getCallId()).getInput());
        return "[PTC] " + call.getToolName() + (summary.isEmpty() ? "" : " " + summary)
                + " @ " + formatTime(call.getCreatedAt()) + " " + statusIcon(CallStatus.forDisplay(call.getStatus()));
    }

    /**
     * Multi-line payload fenced by dashed rules.
     */
    String block(String content, boolean full) {
        if (content == null || content.isBlank()) {
            return "(empty)";
        }
        String stripped = content.strip();
        int limit = properties.getPayloadDisplayLength();
        if (!full && stripped.length() > limit) {
            stripped = stripped.substring(0, limit) + "\n... (" + stripped.length() + " chars total)";
        }
        return "\n" + BLOCK_RULE + "\n" + stripped + "\n" + BLOCK_RULE;
    }

    // ================================================================
    // LINES
    // ================================================================

    String agentLine(CallRecord call, BillingSummary billing, Set<String> unbilled) {
        CallBilling callBilling = billing.billingOf(call.getCallId());
        String duration = callBilling.getDurationIfKnown().map(this::formatDuration).orElse("?");

        String detail = callBilling.isNonBillable()
                ? "— (non-billable | " + duration + ")"
                : "[" + orUnknown(callBilling.getToolset()) + "]  " + billingDetails(call, callBilling) + " | " + duration;

        return String.format("  [Agent] %s @ %s %s  %s%s", call.getToolName(), formatTime(call.getCreatedAt()),
                statusIcon(CallStatus.forDisplay(call.getStatus())), detail, unbilled.contains(call.getCallId()) ? UNBILLED_FLAG : "");
    }

    String ptcLine(CallRecord call, BillingSummary billing, Set<String> unbilled) {
        CallBilling callBilling = billing.billingOf(call.getCallId());
        String detail = callBilling.isNonBillable()
                ? "—"
                : "[" + orUnknown(callBilling.getToolset()) + "]  " + billingDetails(call, callBilling);

        return String.format("    └─ [PTC] %s @ %s %s  %s%s", call.getToolName(), formatTime(call.getCreatedAt()),
                statusIcon(CallStatus.forDisplay(call.getStatus())), detail, unbilled.contains(call.getCallId()) ? UNBILLED_FLAG : "");
    }

    private String billingDetails(CallRecord call, CallBilling billing) {
        String icon;
        if (billing.isCharged()) {
            icon = "💰";
        } else if (call.getCallStatus() == CallStatus.FAILED) {
            icon = "✗";
        } else {
            icon = "⚠️";
        }
        String details = icon + " " + amount(billing.getCreditsCharged()) + " credits";
        if (billing.getDiscountIfAny().isPresent()) {
            details += " (orig: " + amount(billing.getOriginalPrice()) + ", disc: " + amount(billing.getDiscount()) + ")";
        }
        return details;
    }

    // ================================================================
    // HELPERS
    // ================================================================

    static String statusIcon(CallStatus status) {
        return switch (status) {
            case COMPLETED -> "✓";
            case FAILED -> "✗";
            case EXECUTING -> "⟳";
            default -> "?";
        };
    }

    private static String icon(CheckOutcome outcome) {
        return switch (outcome) {
            case PASSED -> "✓";
            case FAILED -> "⚠";
            case SKIPPED -> "—";
        };
    }

    static String truncate(String text, int length, boolean full) {
        if (text == null || text.isBlank()) {
            return "(empty)";
        }
        String stripped = text.strip();
        if (full || stripped.length() <= length) {
            return stripped;
        }
        return stripped.substring(0, length) + "... (" + stripped.length() + " chars total)";
    }

    private String shortCallId(String callId) {
        int limit = properties.getCallIdDisplayLength();
        return callId.length() > limit ? callId.substring(0, limit) + "..." : callId;
    }

    String formatTime(LocalDateTime utc) {
        return utc == null ? "?" : toDisplayZone(utc).format(TIME);
    }

    String formatDateTime(LocalDateTime utc) {
        return utc == null ? "?" : toDisplayZone(utc).format(DATE_TIME);
    }

    private LocalDateTime toDisplayZone(LocalDateTime utc) {
        return utc.atOffset(ZoneOffset.UTC).atZoneSameInstant(properties.getDisplayZone()).toLocalDateTime();
    }

    String formatDuration(Duration duration) {
        return String.format(Locale.ROOT, "%.1fs", duration.toMillis() / 1000.0);
    }

    static String amount(BigDecimal value) {
        if (value == null) {
            return "0";
        }
        return value.signum() == 0 ? "0" : value.stripTrailingZeros().toPlainString();
    }

    private static String orUnknown(String value) {
        return value == null || value.isEmpty() ? "?" : value;
    }

    private static Set<String> unbilledIds(BillingSummary billing) {
        return billing.getAnomalies().stream().map(BillingAnomaly::getCallId).collect(Collectors.toSet());
    }
}
