package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.Context;
import com.bank.fraud.context.SignalHarness;
import com.bank.fraud.ledger.ReferenceDataCache;
import com.bank.fraud.model.BlacklistEntry;
import com.bank.fraud.model.NetworkType;
import com.bank.fraud.model.Severity;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.VpnProxyEntry;
import com.bank.fraud.testutil.InMemoryTransactionLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.bank.fraud.testutil.TestDataFactory.NOW;
import static com.bank.fraud.testutil.TestDataFactory.daysAgo;
import static com.bank.fraud.testutil.TestDataFactory.debit;
import static org.assertj.core.api.Assertions.assertThat;

class BlacklistAndNetworkSignalsTest {

    private InMemoryTransactionLedger ledger;
    private ReferenceDataCache referenceData;
    private BlacklistSignals blacklist;
    private NetworkSignals network;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryTransactionLedger();
        referenceData = new ReferenceDataCache(ledger);
        blacklist = new BlacklistSignals(referenceData);
        network = new NetworkSignals(referenceData);
    }

    private static Transaction fromIp(String ip) {
        return debit("T1", "A1", 100, NOW).toBuilder()
                .metadata("{\"ip_address\": \"" + ip + "\", \"device\": {\"device_id\": \"dev-1\"}}")
                .build();
    }

    private static BlacklistEntry entry(String type, String value, boolean active) {
        return BlacklistEntry.builder()
                .entryId(type + ":" + value).entityType(type).entityValue(value)
                .severity(Severity.HIGH).reason("fraud ring").active(active).addedAt(daysAgo(5))
                .build();
    }

    @Test
    void blacklistedIp_matched() {
        ledger.blacklistEntry(entry("ip", "203.0.113.7", true));
        referenceData.refresh();

        Context ctx = SignalHarness.run(blacklist, fromIp("203.0.113.7"));

        assertThat(ctx.isTrue("blacklist.is_blacklisted")).isTrue();
        assertThat(ctx.text("blacklist.max_severity")).contains("HIGH");
        assertThat(ctx.number("blacklist.match_count")).contains(1.0);
    }

    @Test
    void inactiveOrExpiredEntries_ignored() {
        ledger.blacklistEntry(entry("ip", "203.0.113.7", false))
                .blacklistEntry(BlacklistEntry.builder()
                        .entryId("e2").entityType("device").entityValue("DEV-1").severity(Severity.LOW)
                        .active(true).addedAt(daysAgo(30)).expiresAt(daysAgo(1)).build());
        referenceData.refresh();

        Context ctx = SignalHarness.run(blacklist, fromIp("203.0.113.7"));

        assertThat(ctx.isFalse("blacklist.is_blacklisted")).isTrue();
        assertThat(ctx.has("blacklist.max_severity")).isFalse();
    }

    @Test
    void blacklistedDevice_matchedCaseInsensitively() {
        ledger.blacklistEntry(entry("device", "DEV-1", true));
        referenceData.refresh();

        Context ctx = SignalHarness.run(blacklist, fromIp("198.51.100.1"));

        assertThat(ctx.isTrue("blacklist.is_blacklisted")).isTrue();
    }

    @Test
    void torExitPrefix_detected() {
        ledger.vpnProxyEntry(VpnProxyEntry.builder()
                        .ipPrefix("185.220.101.").networkType(NetworkType.TOR).provider("tor").confidence(0.99)
                        .active(true).build())
                .vpnProxyEntry(VpnProxyEntry.builder()
                        .ipPrefix("185.220.101.5").networkType(NetworkType.VPN).provider("acme-vpn").confidence(0.6)
                        .active(true).build());
        referenceData.refresh();

        Context ctx = SignalHarness.run(network, fromIp("185.220.101.5"));

        assertThat(ctx.isTrue("network.is_tor")).isTrue();
        assertThat(ctx.isTrue("network.is_vpn")).isTrue();
        assertThat(ctx.number("network.max_confidence")).contains(0.99);
        assertThat(ctx.text("network.provider")).contains("tor");
        assertThat(ctx.list("network.matches")).hasSize(2);
    }

    @Test
    void cleanIp_noMatches() {
        referenceData.refresh();

        Context ctx = SignalHarness.run(network, fromIp("8.8.8.8"));

        assertThat(ctx.isFalse("network.is_vpn")).isTrue();
        assertThat(ctx.number("network.max_confidence")).contains(0.0);
    }

    @Test
    void noIp_networkSignalsUnknown() {
        referenceData.refresh();

        Context ctx = SignalHarness.run(network, debit("T1", "A1", 100, NOW));

        assertThat(ctx.has("network.is_tor")).isFalse();
    }
}
