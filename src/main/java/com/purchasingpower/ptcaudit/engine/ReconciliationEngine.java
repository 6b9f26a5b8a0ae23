package com.purchasingpower.ptcaudit.engine;

import com.purchasingpower.ptcaudit.config.ReconciliationProperties;
import com.purchasingpower.ptcaudit.model.billing.BillingSummary;
import com.purchasingpower.ptcaudit.model.billing.UsageTotals;
import com.purchasingpower.ptcaudit.model.call.CallRecord;
import com.purchasingpower.ptcaudit.model.call.CallTree;
import com.purchasingpower.ptcaudit.model.call.ClassifiedCall;
import com.purchasingpower.ptcaudit.model.verification.RunFacts;
import com.purchasingpower.ptcaudit.model.verification.VerificationReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs classification, attribution, billing aggregation and verification over an
 * already-fetched run snapshot.
 *
 * <p>Pure: no I/O, no shared state. The same input always yields the same
 * attribution, totals and issue order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconciliationEngine {

    private final ReconciliationProperties properties;
    private final AttributionResolver attributionResolver;
    private final BillingAggregator billingAggregator;
    private final VerificationEngine verificationEngine;

    public ReconciliationResult reconcile(List<CallRecord> records,
                                          SchemaCapabilities capabilities,
                                          UsageTotals usage,
                                          RunFacts facts) {
        CallClassifier classifier = CallClassifier.forCapabilities(capabilities, properties.getPtcCallIdPrefix());

        List<ClassifiedCall> classified = AttributionResolver.sortByCreation(records.stream()
                .map(r -> new ClassifiedCall(r, classifier.classify(r)))
                .toList());

        CallTree tree = attributionResolver.resolve(classified);
        BillingSummary billing = billingAggregator.aggregate(tree, classified, usage != null ? usage : UsageTotals.empty());
        VerificationReport verification = verificationEngine.verify(tree, billing, facts);

        log.debug("Reconciled {} call records: verdict={}", records.size(), verification.getVerdict());

        return ReconciliationResult.builder()
                .capabilities(capabilities)
                .callTree(tree)
                .billing(billing)
                .facts(facts)
                .verification(verification)
                .build();
    }
}
