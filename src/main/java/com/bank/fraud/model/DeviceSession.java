package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DeviceSession {
    String sessionId;
    String accountId;
    String deviceId;
    String fingerprint;
    String ipAddress;
    String userAgent;
    Instant startedAt;
}
