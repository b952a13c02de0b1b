package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Watchlist/blacklist reference row. entityType is one of account, counterparty,
 * ip, device, email.
 */
@Value
@Builder
public class BlacklistEntry {
    String entryId;
    String entityType;
    String entityValue;
    Severity severity;
    String reason;
    boolean active;
    Instant addedAt;
    Instant expiresAt;

    public boolean isActiveAt(Instant at) {
        if (!active) return false;
        if (addedAt != null && addedAt.isAfter(at)) return false;
        return expiresAt == null || expiresAt.isAfter(at);
    }
}
