package com.bank.fraud.engine.rules;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class GeolocationRules implements RuleSet {

    static final String CATEGORY = "geolocation";

    private final List<Rule> rules;

    public GeolocationRules(MonitoringConfig config) {
        MonitoringConfig.Signals s = config.getSignals();

        this.rules = List.of(
                Rule.blocking("blocked_location", CATEGORY, 5.0,
                        "Transaction from a location blocked by default",
                        (txn, ctx) -> ctx.isTrue("geo.block_by_default")),

                Rule.of("sanctioned_location", CATEGORY, 4.0,
                        "Transaction from a sanctioned or embargoed location",
                        (txn, ctx) -> ctx.isTrue("geo.is_sanctioned") || ctx.isTrue("geo.is_embargoed")),

                Rule.of("high_risk_location", CATEGORY, 2.5,
                        "Transaction from a high-risk location",
                        (txn, ctx) -> ctx.isTrue("geo.is_high_risk_location")),

                Rule.of("impossible_travel", CATEGORY, 4.0,
                        String.format("Travel from last location would need more than %.0f km/h", s.getMaxTravelSpeedKmh()),
                        (txn, ctx) -> ctx.isTrue("geo.is_impossible_travel")),

                Rule.of("new_country", CATEGORY, 1.0,
                        "First transaction from this country",
                        (txn, ctx) -> ctx.isTrue("geo.is_new_country")),

                Rule.of("deviates_from_primary_country", CATEGORY, 1.5,
                        String.format("Outside the country used for %.0f%%+ of history", s.getPrimaryCountryShare() * 100),
                        (txn, ctx) -> ctx.isTrue("geo.deviates_from_primary_country"))
        );
    }

    @Override
    public String prefix() {
        return "geo";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }
}
