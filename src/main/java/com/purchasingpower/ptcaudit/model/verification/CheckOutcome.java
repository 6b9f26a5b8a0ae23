package com.purchasingpower.ptcaudit.model.verification;

public enum CheckOutcome {
    PASSED,
    FAILED,
    SKIPPED
}
