package com.purchasingpower.ptcaudit.model.billing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Aggregated billing for a run.
 *
 * <p>{@code agentCredits} and {@code ptcCredits} are summed over the call
 * tree; orphan and unattributed pass-through calls count towards
 * {@code ptcCredits}. {@code discount} is null unless positive.
 */
@Value
@Builder
public class BillingSummary {
    BigDecimal agentCredits;
    BigDecimal ptcCredits;
    UsageTotals usage;
    BigDecimal discount;

    /**
     * Per-call billing keyed by call id, in input order.
     */
    Map<String, CallBilling> calls;

    @Singular
    List<BillingAnomaly> anomalies;

    @JsonIgnore
    public Optional<BigDecimal> getDiscountIfAny() {
        return Optional.ofNullable(discount);
    }

    public CallBilling billingOf(String callId) {
        return calls.get(callId);
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }
}
