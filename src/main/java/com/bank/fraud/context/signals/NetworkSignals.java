package com.bank.fraud.context.signals;

import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.ReferenceDataCache;
import com.bank.fraud.model.NetworkType;
import com.bank.fraud.model.VpnProxyEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * VPN, proxy, Tor and datacenter lookups for the transaction's IP address.
 */
@Component
public class NetworkSignals implements SignalGroup {

    private final ReferenceDataCache referenceData;

    public NetworkSignals(ReferenceDataCache referenceData) {
        this.referenceData = referenceData;
    }

    @Override
    public String prefix() {
        return "network";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Optional<String> ip = MetadataFields.ipAddress(input.metadata());
        out.put("ip_address", ip.orElse(null));
        if (ip.isEmpty()) {
            return;
        }

        List<VpnProxyEntry> hits = referenceData.findVpnProxyMatches(ip.get());
        VpnProxyEntry strongest = null;
        List<Map<String, Object>> matches = new ArrayList<>();
        for (VpnProxyEntry entry : hits) {
            if (strongest == null || entry.getConfidence() > strongest.getConfidence()) strongest = entry;
            Map<String, Object> match = new LinkedHashMap<>();
            match.put("ip_prefix", entry.getIpPrefix());
            match.put("network_type", entry.getNetworkType() == null ? null : entry.getNetworkType().name());
            match.put("provider", entry.getProvider());
            match.put("confidence", entry.getConfidence());
            matches.add(match);
        }

        out.put("is_vpn", hasType(hits, NetworkType.VPN));
        out.put("is_proxy", hasType(hits, NetworkType.PROXY));
        out.put("is_tor", hasType(hits, NetworkType.TOR));
        out.put("is_datacenter", hasType(hits, NetworkType.DATACENTER));
        out.put("max_confidence", strongest == null ? 0.0 : strongest.getConfidence());
        out.put("provider", strongest == null ? null : strongest.getProvider());
        out.put("matches", matches);
    }

    private static boolean hasType(List<VpnProxyEntry> hits, NetworkType type) {
        return hits.stream().anyMatch(e -> e.getNetworkType() == type);
    }
}
