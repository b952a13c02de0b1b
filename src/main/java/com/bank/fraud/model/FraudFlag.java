package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Historical fraud finding against an account or counterparty.
 */
@Value
@Builder
public class FraudFlag {
    String flagId;
    String entityId;
    String entityType;
    Instant flaggedAt;
    Severity severity;
    boolean confirmed;
    String reason;
}
