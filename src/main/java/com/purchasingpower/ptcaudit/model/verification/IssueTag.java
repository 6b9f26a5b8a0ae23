package com.purchasingpower.ptcaudit.model.verification;

/**
 * Machine-readable tag of a verification issue.
 */
public enum IssueTag {
    PTC_DISABLED,
    NO_MESSAGES,
    NO_TEMP_API_KEY,
    ORPHAN_PTC,
    UNATTRIBUTED_PTC,
    BROKEN_BILLING_REFERENCE,
    UNBILLED_SUCCESS
}
