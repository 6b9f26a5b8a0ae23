package com.purchasingpower.ptcaudit.model.billing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;

/**
 * Billing view of a single call.
 *
 * <p>{@code duration} is null when either timestamp is missing; it is never
 * filled with zero. {@code discount} is only set when the original price
 * exceeds the charged credits.
 */
@Value
@Builder
public class CallBilling {
    String callId;
    String toolset;
    boolean nonBillable;
    BigDecimal creditsCharged;
    BigDecimal originalPrice;
    Duration duration;
    BigDecimal discount;

    @JsonIgnore
    public Optional<Duration> getDurationIfKnown() {
        return Optional.ofNullable(duration);
    }

    @JsonIgnore
    public Optional<BigDecimal> getDiscountIfAny() {
        return Optional.ofNullable(discount);
    }

    @JsonIgnore
    public boolean isCharged() {
        return creditsCharged.signum() > 0;
    }
}
