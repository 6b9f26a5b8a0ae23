package com.purchasingpower.ptcaudit.engine;

import com.purchasingpower.ptcaudit.config.ReconciliationProperties;
import com.purchasingpower.ptcaudit.model.billing.BillingSummary;
import com.purchasingpower.ptcaudit.model.billing.UsageTotals;
import com.purchasingpower.ptcaudit.model.call.CallTree;
import com.purchasingpower.ptcaudit.model.call.ClassifiedCall;
import com.purchasingpower.ptcaudit.model.verification.BillingLinkage;
import com.purchasingpower.ptcaudit.model.verification.CheckOutcome;
import com.purchasingpower.ptcaudit.model.verification.CheckResult;
import com.purchasingpower.ptcaudit.model.verification.CredentialRecord;
import com.purchasingpower.ptcaudit.model.verification.IssueTag;
import com.purchasingpower.ptcaudit.model.verification.RunFacts;
import com.purchasingpower.ptcaudit.model.verification.Verdict;
import com.purchasingpower.ptcaudit.model.verification.VerificationIssue;
import com.purchasingpower.ptcaudit.model.verification.VerificationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static com.purchasingpower.ptcaudit.model.call.CallRecordFixtures.T0;
import static com.purchasingpower.ptcaudit.model.call.CallRecordFixtures.agent;
import static com.purchasingpower.ptcaudit.model.call.CallRecordFixtures.classified;
import static com.purchasingpower.ptcaudit.model.call.CallRecordFixtures.ptc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Verification Engine Tests")
class VerificationEngineTest {

    private VerificationEngine engine;
    private AttributionResolver resolver;
    private BillingAggregator aggregator;

    @BeforeEach
    void setUp() {
        ReconciliationProperties properties = new ReconciliationProperties();
        engine = new VerificationEngine(properties);
        resolver = new AttributionResolver();
        aggregator = new BillingAggregator(properties);
    }

    @Test
    @DisplayName("Clean run with all facts present passes")
    void cleanRun_passes() {
        // Given: no pass-through calls, billed agent call
        List<ClassifiedCall> calls = List.of(classified(agent("a1", 0)));

        // When
        VerificationReport report = verify(calls, healthyFacts().build());

        // Then
        assertTrue(report.getIssues().isEmpty());
        assertEquals(Verdict.PASS, report.getVerdict());
        assertThat(report.getChecks()).extracting(CheckResult::getOutcome)
                .containsExactly(CheckOutcome.PASSED, CheckOutcome.PASSED, CheckOutcome.PASSED,
                        CheckOutcome.SKIPPED, CheckOutcome.PASSED, CheckOutcome.PASSED);
    }

    @Test
    @DisplayName("Orphan pass-through call fails verification")
    void orphan_failsVerification() {
        // Given
        List<ClassifiedCall> calls = List.of(classified(ptc("p1", 0).explicitParentId("X")));

        // When
        VerificationReport report = verify(calls, healthyFacts().build());

        // Then
        assertThat(report.getIssueDetails()).containsExactly("1 orphan PTC call(s)");
        assertEquals(Verdict.FAIL, report.getVerdict());
    }

    @Test
    @DisplayName("Unbilled completed call fails verification")
    void unbilled_failsVerification() {
        // Given
        List<ClassifiedCall> calls = List.of(classified(agent("a1", 0).creditsCharged(BigDecimal.ZERO)));

        // When
        VerificationReport report = verify(calls, healthyFacts().build());

        // Then
        assertThat(report.getIssueDetails()).containsExactly("1 unbilled completed call(s)");
        assertEquals(Verdict.FAIL, report.getVerdict());
    }

    @Test
    @DisplayName("Unattributed pass-through calls get their own issue")
    void unattributed_isDistinctIssue() {
        // Given
        List<ClassifiedCall> calls = List.of(
                classified(ptc("p1", 0)),
                classified(ptc("p2", 1).explicitParentId("missing")));

        // When
        VerificationReport report = verify(calls, healthyFacts().build());

        // Then
        assertThat(report.getIssues()).extracting(VerificationIssue::getTag)
                .containsExactly(IssueTag.ORPHAN_PTC, IssueTag.UNATTRIBUTED_PTC);
        assertThat(report.getIssueDetails())
                .containsExactly("1 orphan PTC call(s)", "1 unattributed PTC call(s)");
    }

    @Test
    @DisplayName("Every check runs even after an early failure, issues keep check order")
    void allChecksRun_issuesInCheckOrder() {
        // Given: every check fails
        List<ClassifiedCall> calls = List.of(
                classified(agent("a1", 0).creditsCharged(BigDecimal.ZERO)),
                classified(ptc("p1", 1).explicitParentId("missing")));
        RunFacts facts = RunFacts.builder()
                .ptcEnabled(false)
                .messageCount(0)
                .ownerUid("u-1")
                .credentialStoreAvailable(true)
                .latestCredential(null)
                .runCreatedAt(T0)
                .billingLinkage(new BillingLinkage(5, 3))
                .build();

        // When
        VerificationReport report = verify(calls, facts);

        // Then
        assertEquals(6, report.getChecks().size());
        assertThat(report.getIssueDetails()).containsExactly(
                "ptc_enabled is false",
                "no action_messages",
                "no temp API key found",
                "1 orphan PTC call(s)",
                "2 broken credit_usage link(s)",
                "1 unbilled completed call(s)");
    }

    @Test
    @DisplayName("Missing flag column, owner or key table skips instead of failing")
    void missingSources_areSkipped() {
        // Given
        RunFacts facts = RunFacts.builder()
                .ptcEnabled(null)
                .messageCount(3)
                .ownerUid(null)
                .build();

        // When
        VerificationReport report = verify(List.of(classified(agent("a1", 0))), facts);

        // Then
        assertTrue(report.isPassed());
        assertEquals(CheckOutcome.SKIPPED, report.getChecks().get(0).getOutcome());
        assertEquals(CheckOutcome.SKIPPED, report.getChecks().get(2).getOutcome());
        assertEquals(CheckOutcome.SKIPPED, report.getChecks().get(4).getOutcome());
    }

    @Test
    @DisplayName("Key must be created no earlier than one window before run start")
    void credentialWindow_isOneHourBeforeRun() {
        LocalDateTime runStart = T0;

        assertTrue(engine.isWithinWindow(new CredentialRecord(runStart.minusMinutes(59), null), runStart));
        assertTrue(engine.isWithinWindow(new CredentialRecord(runStart.minusHours(1), null), runStart));
        assertTrue(engine.isWithinWindow(new CredentialRecord(runStart.plusMinutes(5), null), runStart));
        assertFalse(engine.isWithinWindow(new CredentialRecord(runStart.minusMinutes(61), null), runStart));
        assertFalse(engine.isWithinWindow(null, runStart));
    }

    @Test
    @DisplayName("Unknown run start accepts any key found")
    void credentialWindow_unknownRunStart_acceptsAnyKey() {
        // Given: run without creation time, key created long before
        RunFacts facts = healthyFacts()
                .runCreatedAt(null)
                .latestCredential(new CredentialRecord(T0.minusDays(30), T0.minusDays(29)))
                .build();

        // When
        VerificationReport report = verify(List.of(classified(agent("a1", 0))), facts);

        // Then
        assertTrue(engine.isWithinWindow(new CredentialRecord(T0.minusDays(30), null), null));
        assertEquals(CheckOutcome.PASSED, report.getChecks().get(2).getOutcome());
        assertEquals(Verdict.PASS, report.getVerdict());
    }

    private VerificationReport verify(List<ClassifiedCall> calls, RunFacts facts) {
        CallTree tree = resolver.resolve(calls);
        BillingSummary billing = aggregator.aggregate(tree, AttributionResolver.sortByCreation(calls), UsageTotals.empty());
        return engine.verify(tree, billing, facts);
    }

    private static RunFacts.RunFactsBuilder healthyFacts() {
        return RunFacts.builder()
                .ptcEnabled(true)
                .messageCount(4)
                .ownerUid("u-1")
                .credentialStoreAvailable(true)
                .latestCredential(new CredentialRecord(T0.minusMinutes(1), T0.plusHours(1)))
                .runCreatedAt(T0)
                .billingLinkage(new BillingLinkage(2, 2));
    }
}
