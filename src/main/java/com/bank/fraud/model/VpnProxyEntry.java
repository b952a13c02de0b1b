package com.bank.fraud.model;

import lombok.Builder;
import lombok.Value;

/**
 * Anonymizing-network reference row. ipPrefix is either a full address or a
 * dotted prefix ending in '.', e.g. "185.220.101.".
 */
@Value
@Builder
public class VpnProxyEntry {
    String ipPrefix;
    NetworkType networkType;
    String provider;
    double confidence;
    boolean active;

    public boolean matches(String ipAddress) {
        if (!active || ipAddress == null || ipPrefix == null) return false;
        if (ipPrefix.endsWith(".")) {
            return ipAddress.startsWith(ipPrefix);
        }
        return ipAddress.equals(ipPrefix);
    }
}
