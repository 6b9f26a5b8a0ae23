package com.purchasingpower.ptcaudit.model.verification;

public enum Verdict {
    PASS,
    FAIL
}
