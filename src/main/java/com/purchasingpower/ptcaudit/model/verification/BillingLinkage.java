package com.purchasingpower.ptcaudit.model.verification;

import lombok.Value;

/**
 * Foreign-key completeness of tool-call billing rows: how many billed rows
 * exist and how many of them point at an existing call record.
 */
@Value
public class BillingLinkage {
    long totalBilled;
    long matched;

    public static BillingLinkage none() {
        return new BillingLinkage(0, 0);
    }

    public long getBroken() {
        return totalBilled - matched;
    }
}
