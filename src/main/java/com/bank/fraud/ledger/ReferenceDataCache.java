package com.bank.fraud.ledger;

import com.bank.fraud.exception.LedgerUnavailableException;
import com.bank.fraud.model.BlacklistEntry;
import com.bank.fraud.model.HighRiskLocation;
import com.bank.fraud.model.VpnProxyEntry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-memory snapshot of the reference tables: blacklist, VPN/proxy ranges and high-risk
 * locations. These change rarely and are consulted on every evaluation, so they are
 * loaded once and rebuilt on a schedule instead of scanned per transaction.
 *
 * Each refresh builds new immutable maps and swaps them in; an evaluation always sees
 * one complete snapshot. A failed refresh keeps the previous snapshot. Lookups before
 * the first successful load fail with {@link LedgerUnavailableException} rather than
 * reporting "no match".
 */
@Service
public class ReferenceDataCache {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDataCache.class);

    private final TransactionLedger ledger;

    // entity type (lower case) -> entity value (lower case) -> entries
    private volatile Map<String, Map<String, List<BlacklistEntry>>> blacklist = Collections.emptyMap();

    private volatile List<VpnProxyEntry> vpnProxyEntries = Collections.emptyList();

    // country (lower case) -> locations
    private volatile Map<String, List<HighRiskLocation>> highRiskLocations = Collections.emptyMap();

    private volatile boolean loaded = false;
    private volatile Instant lastRefreshTime = Instant.EPOCH;

    public ReferenceDataCache(TransactionLedger ledger) {
        this.ledger = ledger;
    }

    @PostConstruct
    public void init() {
        refresh();
    }

    @Scheduled(fixedDelayString = "${monitoring.reference-refresh-ms:300000}",
            initialDelayString = "${monitoring.reference-refresh-ms:300000}")
    public void refresh() {
        log.info("Refreshing reference data...");
        Instant start = Instant.now();

        List<BlacklistEntry> blacklistEntries;
        List<VpnProxyEntry> vpnEntries;
        List<HighRiskLocation> locations;
        try {
            blacklistEntries = ledger.findAllBlacklistEntries();
            vpnEntries = ledger.findAllVpnProxyEntries();
            locations = ledger.findAllHighRiskLocations();
        } catch (LedgerUnavailableException e) {
            if (loaded) {
                log.warn("Reference data refresh failed, keeping snapshot from {}: {}",
                        lastRefreshTime, e.getMessage());
            } else {
                log.error("Reference data could not be loaded: {}", e.getMessage());
            }
            return;
        }

        Map<String, Map<String, List<BlacklistEntry>>> newBlacklist = new HashMap<>();
        for (BlacklistEntry entry : blacklistEntries) {
            if (entry.getEntityType() == null || entry.getEntityValue() == null) continue;
            newBlacklist
                    .computeIfAbsent(key(entry.getEntityType()), k -> new HashMap<>())
                    .computeIfAbsent(key(entry.getEntityValue()), k -> new ArrayList<>())
                    .add(entry);
        }

        Map<String, List<HighRiskLocation>> newLocations = locations.stream()
                .filter(l -> l.getCountry() != null)
                .collect(Collectors.groupingBy(l -> key(l.getCountry())));

        this.blacklist = freeze(newBlacklist);
        this.vpnProxyEntries = List.copyOf(vpnEntries);
        this.highRiskLocations = Map.copyOf(newLocations.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> List.copyOf(e.getValue()))));
        this.loaded = true;
        this.lastRefreshTime = Instant.now();

        log.info("Reference data refreshed in {}ms: {} blacklist entries, {} VPN/proxy ranges, {} high-risk locations",
                Duration.between(start, lastRefreshTime).toMillis(),
                blacklistEntries.size(), vpnEntries.size(), locations.size());
    }

    /**
     * Blacklist entries for an entity that are active at the given instant.
     */
    public List<BlacklistEntry> findActiveBlacklistEntries(String entityType, String entityValue, Instant at) {
        ensureLoaded();
        if (entityType == null || entityValue == null || entityValue.isBlank()) {
            return List.of();
        }
        List<BlacklistEntry> entries = blacklist
                .getOrDefault(key(entityType), Collections.emptyMap())
                .getOrDefault(key(entityValue), Collections.emptyList());
        return entries.stream().filter(e -> e.isActiveAt(at)).collect(Collectors.toList());
    }

    public List<VpnProxyEntry> findVpnProxyMatches(String ipAddress) {
        ensureLoaded();
        if (ipAddress == null || ipAddress.isBlank()) {
            return List.of();
        }
        return vpnProxyEntries.stream().filter(e -> e.matches(ipAddress)).collect(Collectors.toList());
    }

    public List<HighRiskLocation> findHighRiskLocations(String country, String city) {
        ensureLoaded();
        if (country == null || country.isBlank()) {
            return List.of();
        }
        return highRiskLocations.getOrDefault(key(country), Collections.emptyList()).stream()
                .filter(l -> l.matches(country, city))
                .collect(Collectors.toList());
    }

    public boolean isLoaded() {
        return loaded;
    }

    public Instant getLastRefreshTime() {
        return lastRefreshTime;
    }

    private void ensureLoaded() {
        if (!loaded) {
            throw new LedgerUnavailableException("Reference data has not been loaded yet", null);
        }
    }

    private static String key(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, Map<String, List<BlacklistEntry>>> freeze(
            Map<String, Map<String, List<BlacklistEntry>>> source) {
        Map<String, Map<String, List<BlacklistEntry>>> frozen = new HashMap<>();
        source.forEach((type, byValue) -> {
            Map<String, List<BlacklistEntry>> inner = new HashMap<>();
            byValue.forEach((value, entries) -> inner.put(value, List.copyOf(entries)));
            frozen.put(type, Collections.unmodifiableMap(inner));
        });
        return Collections.unmodifiableMap(frozen);
    }
}
