package com.purchasingpower.ptcaudit.service;

import com.purchasingpower.ptcaudit.model.dto.ReconciliationReport;

/**
 * Builds the reconciliation report of one run: call attribution, billing and
 * verification.
 */
public interface ReconciliationService {

    /**
     * @param identifier       result id ({@code ar-}/{@code sk-}) or canvas id ({@code c-})
     * @param title            exact title to pick a run on a canvas, nullable
     * @param includeBreakdown also fetch the per-toolset breakdown
     * @return report of the resolved run
     * @throws com.purchasingpower.ptcaudit.exception.RunNotFoundException           no run matched
     * @throws com.purchasingpower.ptcaudit.exception.InvalidRunIdentifierException malformed identifier
     * @throws com.purchasingpower.ptcaudit.exception.ReconciliationException       the store could not be read
     */
    ReconciliationReport reconcile(String identifier, String title, boolean includeBreakdown);

    /**
     * Same report without the breakdown, plus the run's conversation and the
     * input, output and error of every call.
     *
     * @param identifier result id or canvas id, as for {@link #reconcile}
     * @param title      exact title to pick a run on a canvas, nullable
     * @return report with {@code calling} filled
     */
    ReconciliationReport traceCalls(String identifier, String title);
}
