package com.purchasingpower.ptcaudit.model.verification;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Structural facts about a run fetched by separate queries, consumed by the
 * verification engine.
 *
 * <p>{@code ptcEnabled} is null when the column does not exist (older schema).
 * {@code latestCredential} is null when no key was found.
 */
@Value
@Builder
public class RunFacts {
    Boolean ptcEnabled;
    long messageCount;
    String ownerUid;
    boolean credentialStoreAvailable;
    CredentialRecord latestCredential;
    LocalDateTime runCreatedAt;

    @Builder.Default
    BillingLinkage billingLinkage = BillingLinkage.none();
}
