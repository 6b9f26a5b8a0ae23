package com.purchasingpower.ptcaudit.model.call;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One row of the raw tool-call log of a run, joined with its billing record.
 *
 * <p>{@code typeTag} and {@code explicitParentId} are only populated when the
 * store carries the {@code type} / {@code ptc_call_id} columns. Credit amounts
 * default to zero when no billing row exists.
 *
 * <p>{@code status} is kept as stored; {@link #getCallStatus()} parses it
 * strictly.
 *
 * <p>{@code creditsCharged <= originalPrice} is expected but not enforced here.
 */
@Value
@Builder(toBuilder = true)
public class CallRecord {

    String callId;
    String toolName;
    String typeTag;
    String status;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
    String explicitParentId;
    String toolsetId;
    String billingToolsetKey;

    @Builder.Default
    BigDecimal creditsCharged = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal originalPrice = BigDecimal.ZERO;

    public CallStatus getCallStatus() {
        return CallStatus.fromValue(status);
    }

    /**
     * @return true when a parent reference is present; blank counts as absent
     */
    public boolean hasExplicitParent() {
        return explicitParentId != null && !explicitParentId.isBlank();
    }

    /**
     * Toolset shown for billing: the key recorded on the billing row wins over
     * the tool call's own toolset id.
     */
    public String displayToolset() {
        if (billingToolsetKey != null && !billingToolsetKey.isBlank()) {
            return billingToolsetKey;
        }
        return toolsetId;
    }
}
