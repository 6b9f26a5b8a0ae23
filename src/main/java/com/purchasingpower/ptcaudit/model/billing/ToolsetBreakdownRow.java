package com.purchasingpower.ptcaudit.model.billing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One row of the per-toolset breakdown: calls grouped by toolset, tool name
 * and call type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolsetBreakdownRow {
    private String toolset;
    private String toolName;
    private String callType;
    private long calls;
    private long successCount;
    private BigDecimal totalCredits;
    private BigDecimal originalPrice;
}
