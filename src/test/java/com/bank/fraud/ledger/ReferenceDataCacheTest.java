package com.bank.fraud.ledger;

import com.bank.fraud.exception.LedgerUnavailableException;
import com.bank.fraud.model.BlacklistEntry;
import com.bank.fraud.model.HighRiskLocation;
import com.bank.fraud.model.NetworkType;
import com.bank.fraud.model.Severity;
import com.bank.fraud.model.VpnProxyEntry;
import com.bank.fraud.testutil.InMemoryTransactionLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.bank.fraud.testutil.TestDataFactory.NOW;
import static com.bank.fraud.testutil.TestDataFactory.daysAgo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceDataCacheTest {

    private InMemoryTransactionLedger ledger;
    private ReferenceDataCache cache;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryTransactionLedger();
        cache = new ReferenceDataCache(ledger);
    }

    private static BlacklistEntry blacklisted(String type, String value, boolean active) {
        return BlacklistEntry.builder().entryId(type + ":" + value).entityType(type).entityValue(value)
                .severity(Severity.HIGH).active(active).addedAt(daysAgo(10)).build();
    }

    @Test
    void lookupBeforeFirstLoad_throws() {
        assertThatThrownBy(() -> cache.findVpnProxyMatches("10.0.0.1"))
                .isInstanceOf(LedgerUnavailableException.class);
        assertThat(cache.isLoaded()).isFalse();
    }

    @Test
    void firstLoadFails_staysUnloaded() {
        ledger.setAvailable(false);

        cache.refresh();

        assertThat(cache.isLoaded()).isFalse();
        assertThatThrownBy(() -> cache.findHighRiskLocations("IR", null))
                .isInstanceOf(LedgerUnavailableException.class);
    }

    @Test
    void blacklistLookup_caseInsensitiveAndActiveOnly() {
        ledger.blacklistEntry(blacklisted("email", "Mule@Example.com", true))
                .blacklistEntry(blacklisted("ip", "203.0.113.9", false));
        cache.refresh();

        assertThat(cache.findActiveBlacklistEntries("EMAIL", "mule@example.com ", NOW)).hasSize(1);
        assertThat(cache.findActiveBlacklistEntries("ip", "203.0.113.9", NOW)).isEmpty();
        assertThat(cache.findActiveBlacklistEntries("email", "", NOW)).isEmpty();
    }

    @Test
    void vpnPrefixAndHighRiskCity_match() {
        ledger.vpnProxyEntry(VpnProxyEntry.builder().ipPrefix("185.220.101.").networkType(NetworkType.TOR)
                        .confidence(0.95).active(true).build())
                .highRiskLocation(HighRiskLocation.builder().country("NG").city("Lagos")
                        .severity(Severity.MEDIUM).highFraudRate(true).build());
        cache.refresh();

        assertThat(cache.findVpnProxyMatches("185.220.101.44")).hasSize(1);
        assertThat(cache.findVpnProxyMatches("185.220.10.44")).isEmpty();
        assertThat(cache.findHighRiskLocations("ng", "LAGOS")).hasSize(1);
        assertThat(cache.findHighRiskLocations("NG", "Abuja")).isEmpty();
    }

    @Test
    void refreshFailure_keepsPreviousSnapshot() {
        ledger.blacklistEntry(blacklisted("account", "ACC-9", true));
        cache.refresh();

        ledger.setAvailable(false);
        cache.refresh();

        assertThat(cache.isLoaded()).isTrue();
        assertThat(cache.findActiveBlacklistEntries("account", "ACC-9", NOW)).hasSize(1);
    }
}
