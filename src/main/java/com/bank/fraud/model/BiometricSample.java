package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One captured session of behavioral biometrics. Any metric may be null when the
 * channel did not capture it.
 */
@Value
@Builder
public class BiometricSample {
    String sampleId;
    String accountId;
    Instant capturedAt;
    Double typingSpeed;
    Double sessionDurationSeconds;
    Double mouseSpeed;
    Double copyPasteCount;
    Boolean autofillUsed;
}
