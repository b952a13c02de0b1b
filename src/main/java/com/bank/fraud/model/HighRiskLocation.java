package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

/**
 * High-risk country or city. A null city covers the whole country.
 */
@Value
@Builder
public class HighRiskLocation {
    String country;
    String city;
    Severity severity;
    boolean sanctioned;
    boolean embargoed;
    boolean highFraudRate;
    boolean blockByDefault;
    String reason;

    public boolean matches(String txCountry, String txCity) {
        if (country == null || txCountry == null || !country.equalsIgnoreCase(txCountry)) {
            return false;
        }
        return city == null || (txCity != null && city.equalsIgnoreCase(txCity));
    }
}
