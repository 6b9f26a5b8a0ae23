package com.purchasingpower.ptcaudit.model.billing;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A billing inconsistency found on one call. Recorded as data, never thrown.
 */
@Value
@Builder
public class BillingAnomaly {
    AnomalyKind kind;
    String callId;
    String toolName;
    String toolset;
    LocalDateTime timestamp;
}
