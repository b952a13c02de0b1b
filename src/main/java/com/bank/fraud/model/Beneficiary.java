package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A payee registered on an account. The counterpartyId links it to ledger transactions.
 */
@Value
@Builder
public class Beneficiary {
    String beneficiaryId;
    String accountId;
    String counterpartyId;
    String name;
    Instant addedAt;
    String addedBy;
    String additionSource;
    String ipAddress;
    boolean verified;
    Instant lastPaymentAt;
}
