package com.purchasingpower.ptcaudit.model.verification;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Temporary API key issued to the sandbox of a run.
 */
@Value
public class CredentialRecord {
    LocalDateTime createdAt;
    LocalDateTime expiresAt;
}
