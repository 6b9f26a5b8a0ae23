package com.purchasingpower.ptcaudit.model.billing;

/**
 * Billing inconsistencies detected per call.
 */
public enum AnomalyKind {

    /**
     * Call completed, charged nothing, and its tool is not on the free list.
     */
    UNBILLED_SUCCESS
}
