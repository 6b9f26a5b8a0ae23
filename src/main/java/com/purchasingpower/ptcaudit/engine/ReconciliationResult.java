package com.purchasingpower.ptcaudit.engine;

import com.purchasingpower.ptcaudit.model.billing.BillingSummary;
import com.purchasingpower.ptcaudit.model.call.CallTree;
import com.purchasingpower.ptcaudit.model.verification.RunFacts;
import com.purchasingpower.ptcaudit.model.verification.VerificationReport;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the engine derives from one run snapshot.
 */
@Value
@Builder
public class ReconciliationResult {
    SchemaCapabilities capabilities;
    CallTree callTree;
    BillingSummary billing;
    RunFacts facts;
    VerificationReport verification;
}
