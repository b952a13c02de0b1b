package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * A change to a beneficiary's payment details (account number, routing number, bank name).
 */
@Value
@Builder
public class BeneficiaryChange {

    public static final Set<String> BANK_DETAIL_TYPES = Set.of("account_number", "routing_number", "bank_name");

    String changeId;
    String beneficiaryId;
    String changeType;
    Instant changedAt;
    boolean verified;
    String changeSource;
    String requestorName;

    public boolean isBankDetailChange() {
        return changeType != null && BANK_DETAIL_TYPES.contains(changeType.toLowerCase(Locale.ROOT));
    }
}
