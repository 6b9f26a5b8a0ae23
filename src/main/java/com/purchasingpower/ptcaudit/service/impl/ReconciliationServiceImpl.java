package com.purchasingpower.ptcaudit.service.impl;

import com.purchasingpower.ptcaudit.config.ReconciliationProperties;
import com.purchasingpower.ptcaudit.engine.ReconciliationEngine;
import com.purchasingpower.ptcaudit.engine.ReconciliationResult;
import com.purchasingpower.ptcaudit.engine.SchemaCapabilities;
import com.purchasingpower.ptcaudit.engine.SchemaCapabilityProbe;
import com.purchasingpower.ptcaudit.exception.ReconciliationException;
import com.purchasingpower.ptcaudit.model.billing.ToolsetBreakdownRow;
import com.purchasingpower.ptcaudit.model.billing.UsageTotals;
import com.purchasingpower.ptcaudit.model.call.CallRecord;
import com.purchasingpower.ptcaudit.model.calling.CallingDetails;
import com.purchasingpower.ptcaudit.model.dto.ReconciliationReport;
import com.purchasingpower.ptcaudit.model.run.ActionResultEntity;
import com.purchasingpower.ptcaudit.model.run.RunInfo;
import com.purchasingpower.ptcaudit.model.verification.CredentialRecord;
import com.purchasingpower.ptcaudit.model.verification.RunFacts;
import com.purchasingpower.ptcaudit.repository.ConversationRepository;
import com.purchasingpower.ptcaudit.repository.CreditUsageRepository;
import com.purchasingpower.ptcaudit.repository.RunFactsRepository;
import com.purchasingpower.ptcaudit.repository.SchemaColumnRepository;
import com.purchasingpower.ptcaudit.repository.ToolCallRecordRepository;
import com.purchasingpower.ptcaudit.service.ReconciliationService;
import com.purchasingpower.ptcaudit.service.RunResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Implementation of ReconciliationService.
 *
 * <p>Fetches one snapshot of the run (call log, billing sums, structural facts)
 * and hands it to the {@link ReconciliationEngine}. Everything runs in a single
 * read-only transaction; nothing is written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationServiceImpl implements ReconciliationService {

    static final String PTC_ENABLED_COLUMN = "ptc_enabled";
    static final String CREDENTIAL_TABLE = "user_api_keys";
    private static final LocalDateTime EPOCH = LocalDateTime.of(1970, 1, 1, 0, 0);

    private final RunResolver runResolver;
    private final SchemaColumnRepository schemaColumns;
    private final SchemaCapabilityProbe capabilityProbe;
    private final ToolCallRecordRepository toolCalls;
    private final ConversationRepository conversations;
    private final CreditUsageRepository creditUsages;
    private final RunFactsRepository runFacts;
    private final ReconciliationEngine engine;
    private final ReconciliationProperties properties;

    @Override
    @Transactional(readOnly = true)
    public ReconciliationReport reconcile(String identifier, String title, boolean includeBreakdown) {
        return buildReport(identifier, title, includeBreakdown, false);
    }

    @Override
    @Transactional(readOnly = true)
    public ReconciliationReport traceCalls(String identifier, String title) {
        return buildReport(identifier, title, false, true);
    }

    private ReconciliationReport buildReport(String identifier, String title,
                                             boolean includeBreakdown, boolean includeCalling) {
        String resultId = identifier;
        Integer version = null;

        try {
            ActionResultEntity run = runResolver.resolve(identifier, title);
            resultId = run.getResultId();
            version = run.getVersion();

            Boolean ptcEnabled = schemaColumns.hasColumn("action_results", PTC_ENABLED_COLUMN)
                    ? runFacts.findPtcEnabled(resultId, version).orElse(null)
                    : null;

            SchemaCapabilities capabilities = capabilityProbe.probe(schemaColumns.findOptionalToolCallColumns());
            List<CallRecord> records = toolCalls.findBillingCalls(resultId, version, capabilities);
            UsageTotals usage = creditUsages.sumUsage(resultId, version);
            RunFacts facts = fetchFacts(run, ptcEnabled, resultId, version);

            ReconciliationResult result = engine.reconcile(records, capabilities, usage, facts);

            List<ToolsetBreakdownRow> breakdown = includeBreakdown
                    ? toolCalls.findToolsetBreakdown(resultId, version, capabilities)
                    : List.of();

            CallingDetails calling = includeCalling
                    ? CallingDetails.builder()
                        .messages(conversations.findMessages(resultId, version))
                        .payloads(toolCalls.findCallPayloads(resultId, version))
                        .build()
                    : null;

            log.info("Reconciled {} v{}: {} agent + {} ptc calls, verdict {}",
                    resultId, version,
                    result.getCallTree().getAgentCount(), result.getCallTree().getPtcCount(),
                    result.getVerification().getVerdict());

            return ReconciliationReport.builder()
                    .run(RunInfo.from(run, ptcEnabled))
                    .capabilities(capabilities)
                    .callTree(result.getCallTree())
                    .billing(result.getBilling())
                    .facts(result.getFacts())
                    .verification(result.getVerification())
                    .toolsetBreakdown(breakdown)
                    .calling(calling)
                    .build();

        } catch (DataAccessException e) {
            log.error("Failed to read run data for {} v{}", resultId, version != null ? version : "?", e);
            throw new ReconciliationException("Failed to read run data: " + e.getMostSpecificCause().getMessage(),
                    resultId, e);
        }
    }

    private RunFacts fetchFacts(ActionResultEntity run, Boolean ptcEnabled, String resultId, int version) {
        String uid = run.getUid();
        boolean credentialStore = uid != null && schemaColumns.tableExists(CREDENTIAL_TABLE);

        CredentialRecord credential = null;
        if (credentialStore) {
            // TODO: without a run creation time the lookup spans every key the user ever created; see VerificationEngine.isWithinWindow
            LocalDateTime since = run.getCreatedAt() != null
                    ? run.getCreatedAt().minus(properties.getCredentialWindow())
                    : EPOCH;
            credential = runFacts.findLatestCredential(uid, since).orElse(null);
        }

        return RunFacts.builder()
                .ptcEnabled(ptcEnabled)
                .messageCount(runFacts.countMessages(resultId, version))
                .ownerUid(uid)
                .credentialStoreAvailable(credentialStore)
                .latestCredential(credential)
                .runCreatedAt(run.getCreatedAt())
                .billingLinkage(creditUsages.findBillingLinkage(resultId, version))
                .build();
    }
}
