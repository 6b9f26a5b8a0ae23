package com.purchasingpower.ptcaudit.model.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Run-level sums from {@code credit_usages}, split by usage type.
 *
 * <p>Model usage is not call-scoped, so it is only available here and not
 * from the call tree.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageTotals {

    @Builder.Default
    private BigDecimal toolCredits = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal modelCredits = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal totalCredits = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal toolOriginalPrice = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal modelOriginalPrice = BigDecimal.ZERO;

    public static UsageTotals empty() {
        return UsageTotals.builder().build();
    }

    public BigDecimal getOriginalPriceTotal() {
        return toolOriginalPrice.add(modelOriginalPrice);
    }
}
