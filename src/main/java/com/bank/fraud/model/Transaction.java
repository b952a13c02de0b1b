package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A ledger transaction submitted for fraud evaluation. Immutable once ingested.
 *
 * The metadata field carries the raw JSON object exactly as ingested; it may embed
 * device, geo, check, behavior and social sub-objects. Use {@link TransactionMetadata#parse}
 * to read it.
 */
@Value
@Builder(toBuilder = true)
public class Transaction {

    String transactionId;

    String accountId;

    // Optional: cash deposits and fees have no counterparty
    String counterpartyId;

    // Magnitude; direction carries the sign
    double amount;

    Direction direction;

    // Free-form category, e.g. WIRE, ACH, CHECK, DEPOSIT
    String transactionType;

    Instant timestamp;

    String description;

    String metadata;

    public boolean isOutbound() {
        return direction == Direction.DEBIT;
    }

    public boolean isInbound() {
        return direction == Direction.CREDIT;
    }

    public boolean hasCounterparty() {
        return counterpartyId != null && !counterpartyId.isBlank();
    }

    public boolean isType(String type) {
        return transactionType != null && transactionType.equalsIgnoreCase(type);
    }
}
