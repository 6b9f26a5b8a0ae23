package com.purchasingpower.ptcaudit.model.verification;

import lombok.Value;

/**
 * A failed check: tag plus the detail shown to the user.
 */
@Value
public class VerificationIssue {
    IssueTag tag;
    String detail;

    @Override
    public String toString() {
        return detail;
    }
}
