package com.purchasingpower.ptcaudit.model.verification;

import lombok.Value;

import java.util.List;

/**
 * Result of the verification battery.
 *
 * <p>Immutable. The verdict is {@link Verdict#PASS} iff {@code issues} is empty.
 */
@Value
public class VerificationReport {
    List<CheckResult> checks;
    List<VerificationIssue> issues;

    public VerificationReport(List<CheckResult> checks, List<VerificationIssue> issues) {
        this.checks = List.copyOf(checks);
        this.issues = List.copyOf(issues);
    }

    public Verdict getVerdict() {
        return issues.isEmpty() ? Verdict.PASS : Verdict.FAIL;
    }

    public boolean isPassed() {
        return getVerdict() == Verdict.PASS;
    }

    public List<String> getIssueDetails() {
        return issues.stream().map(VerificationIssue::getDetail).toList();
    }
}
