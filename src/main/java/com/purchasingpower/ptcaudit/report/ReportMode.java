package com.purchasingpower.ptcaudit.report;

import java.util.Locale;

/**
 * Which text report to render.
 */
public enum ReportMode {

    /**
     * Billing timeline followed by the consolidated checks and the verdict.
     */
    VERIFY,

    /**
     * Per-call credits with inline totals, discounts and billing warnings.
     */
    BILLING,

    /**
     * Conversation messages and every call with its input, output and error.
     */
    CALLING;

    public static ReportMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return VERIFY;
        }
        return ReportMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
