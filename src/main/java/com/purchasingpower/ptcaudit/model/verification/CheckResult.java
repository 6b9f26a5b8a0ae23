package com.purchasingpower.ptcaudit.model.verification;

import lombok.Value;

/**
 * Outcome of one check, kept for rendering alongside the issue list.
 *
 * <p>{@code source} names the record set the check looked at
 * (e.g. {@code action_messages}).
 */
@Value
public class CheckResult {
    String source;
    CheckOutcome outcome;
    String message;

    public static CheckResult passed(String source, String message) {
        return new CheckResult(source, CheckOutcome.PASSED, message);
    }

    public static CheckResult failed(String source, String message) {
        return new CheckResult(source, CheckOutcome.FAILED, message);
    }

    public static CheckResult skipped(String source, String message) {
        return new CheckResult(source, CheckOutcome.SKIPPED, message);
    }
}
