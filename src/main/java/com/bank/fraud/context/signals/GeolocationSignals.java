package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalMath;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.ReferenceDataCache;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.HighRiskLocation;
import com.bank.fraud.model.Severity;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TransactionMetadata;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Where the transaction originated, compared against high-risk locations, the account's
 * usual countries, and the last known position (impossible travel).
 */
@Component
public class GeolocationSignals implements SignalGroup {

    private final TransactionLedger ledger;
    private final ReferenceDataCache referenceData;
    private final MonitoringConfig.Signals config;

    public GeolocationSignals(TransactionLedger ledger, ReferenceDataCache referenceData, MonitoringConfig config) {
        this.ledger = ledger;
        this.referenceData = referenceData;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "geo";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Optional<String> country = MetadataFields.country(input.metadata());
        Optional<String> city = MetadataFields.city(input.metadata());
        Optional<double[]> coordinates = MetadataFields.coordinates(input.metadata());

        out.put("country", country.map(c -> c.toUpperCase(Locale.ROOT)).orElse(null));
        out.put("city", city.orElse(null));

        if (country.isEmpty() && coordinates.isEmpty()) {
            // Nothing to locate; every location signal stays unknown
            return;
        }

        if (country.isPresent()) {
            highRiskLocation(country.get(), city.orElse(null), out);
        }

        List<Located> history = locatedHistory(input);
        if (country.isPresent()) {
            countryPattern(country.get(), history, out);
        }
        coordinates.ifPresent(c -> travel(input.at(), c, history, out));
    }

    // --- High-risk reference table ---
    private void highRiskLocation(String country, String city, SignalWriter out) {
        List<HighRiskLocation> matches = referenceData.findHighRiskLocations(country, city);

        Severity maxSeverity = null;
        List<Map<String, Object>> details = new ArrayList<>();
        for (HighRiskLocation location : matches) {
            maxSeverity = Severity.max(maxSeverity, location.getSeverity());
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("country", location.getCountry());
            detail.put("city", location.getCity());
            detail.put("severity", location.getSeverity() == null ? null : location.getSeverity().name());
            detail.put("reason", location.getReason());
            details.add(detail);
        }

        out.put("is_high_risk_location", !matches.isEmpty());
        out.put("high_risk_max_severity", maxSeverity == null ? null : maxSeverity.name());
        out.put("is_sanctioned", matches.stream().anyMatch(HighRiskLocation::isSanctioned));
        out.put("is_embargoed", matches.stream().anyMatch(HighRiskLocation::isEmbargoed));
        out.put("is_high_fraud_rate", matches.stream().anyMatch(HighRiskLocation::isHighFraudRate));
        out.put("block_by_default", matches.stream().anyMatch(HighRiskLocation::isBlockByDefault));
        out.put("high_risk_matches", details);
    }

    // --- Historical countries ---
    private void countryPattern(String country, List<Located> history, SignalWriter out) {
        Map<String, Long> counts = new TreeMap<>();
        for (Located located : history) {
            if (located.country != null) counts.merge(located.country, 1L, Long::sum);
        }
        out.put("historical_countries", new ArrayList<>(counts.keySet()));
        if (counts.isEmpty()) {
            out.unknown("is_new_country");
            out.unknown("primary_country");
            out.unknown("primary_country_share");
            out.unknown("deviates_from_primary_country");
            return;
        }

        String current = country.toUpperCase(Locale.ROOT);
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        Map.Entry<String, Long> primary = null;
        for (Map.Entry<String, Long> e : counts.entrySet()) {
            if (primary == null || e.getValue() > primary.getValue()) primary = e;
        }
        double share = (double) primary.getValue() / total;

        out.put("is_new_country", !counts.containsKey(current));
        out.put("primary_country", primary.getKey());
        out.put("primary_country_share", share);
        out.put("deviates_from_primary_country",
                share >= config.getPrimaryCountryShare() && !primary.getKey().equals(current));
    }

    // --- Impossible travel ---
    private void travel(Instant at, double[] current, List<Located> history, SignalWriter out) {
        Located last = null;
        for (Located located : history) {
            if (located.coordinates != null) last = located;
        }
        if (last == null) {
            out.unknown("distance_km");
            out.unknown("hours_since_last_location");
            out.unknown("required_speed_kmh");
            out.unknown("is_impossible_travel");
            return;
        }

        double distance = SignalMath.haversineKm(last.coordinates[0], last.coordinates[1], current[0], current[1]);
        double hours = SignalInput.hoursBetween(last.at, at);
        // Sub-minute gaps are treated as one minute
        double speed = distance / Math.max(hours, 1.0 / 60.0);

        out.put("distance_km", distance);
        out.put("hours_since_last_location", hours);
        out.put("required_speed_kmh", speed);
        out.put("is_impossible_travel",
                speed > config.getMaxTravelSpeedKmh() && distance > config.getMinTravelDistanceKm());
    }

    private List<Located> locatedHistory(SignalInput input) {
        List<Transaction> prior = input.priorOnly(ledger.findTransactions(
                input.transaction().getAccountId(), input.daysBack(config.getGeoLookbackDays()), input.at()));
        List<Located> located = new ArrayList<>();
        for (Transaction t : prior) {
            Optional<TransactionMetadata> metadata = input.metadataOf(t, prefix());
            if (metadata.isEmpty()) continue;
            String country = MetadataFields.country(metadata.get()).map(c -> c.toUpperCase(Locale.ROOT)).orElse(null);
            double[] coordinates = MetadataFields.coordinates(metadata.get()).orElse(null);
            if (country != null || coordinates != null) {
                located.add(new Located(t.getTimestamp(), country, coordinates));
            }
        }
        return located;
    }

    private static final class Located {
        final Instant at;
        final String country;
        final double[] coordinates;

        Located(Instant at, String country, double[] coordinates) {
            this.at = at;
            this.country = country;
            this.coordinates = coordinates;
        }
    }
}
