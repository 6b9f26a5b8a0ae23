package com.purchasingpower.ptcaudit.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.ptcaudit.engine.SchemaCapabilities;
import com.purchasingpower.ptcaudit.model.billing.BillingSummary;
import com.purchasingpower.ptcaudit.model.billing.ToolsetBreakdownRow;
import com.purchasingpower.ptcaudit.model.call.CallTree;
import com.purchasingpower.ptcaudit.model.calling.CallingDetails;
import com.purchasingpower.ptcaudit.model.run.RunInfo;
import com.purchasingpower.ptcaudit.model.verification.RunFacts;
import com.purchasingpower.ptcaudit.model.verification.Verdict;
import com.purchasingpower.ptcaudit.model.verification.VerificationReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response DTO for the reconciliation API and input of the text reports.
 *
 * <p>Carries the attributed call tree, per-call and aggregate billing, the
 * verification outcome and the facts it was computed from.
 *
 * @see com.purchasingpower.ptcaudit.controller.ReconciliationController
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReport {
    private RunInfo run;
    private SchemaCapabilities capabilities;
    private CallTree callTree;
    private BillingSummary billing;
    private RunFacts facts;
    private VerificationReport verification;

    /**
     * Only filled when the breakdown was requested.
     */
    @Builder.Default
    private List<ToolsetBreakdownRow> toolsetBreakdown = new ArrayList<>();

    /**
     * Conversation and call payloads, only filled for the calling trace.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private CallingDetails calling;

    public int getAgentCount() {
        return callTree.getAgentCount();
    }

    public int getPtcCount() {
        return callTree.getPtcCount();
    }

    public Verdict getVerdict() {
        return verification.getVerdict();
    }
}
