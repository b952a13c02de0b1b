package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Account {
    String accountId;
    Instant createdAt;
    String riskTier;
    String status;
}
