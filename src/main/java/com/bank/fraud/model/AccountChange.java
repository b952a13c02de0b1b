package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A credential or contact-point change on an account. changeType is one of
 * phone, device, sim, email, password (lower case).
 */
@Value
@Builder
public class AccountChange {
    String changeId;
    String accountId;
    String changeType;
    Instant changedAt;
    String channel;
}
