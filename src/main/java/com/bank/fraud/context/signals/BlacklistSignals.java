package com.bank.fraud.context.signals;

import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.ReferenceDataCache;
import com.bank.fraud.model.BlacklistEntry;
import com.bank.fraud.model.Severity;
import com.bank.fraud.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches the account, counterparty, IP, device and email of the transaction against
 * active blacklist entries, reduced to a single max severity plus the individual hits.
 */
@Component
public class BlacklistSignals implements SignalGroup {

    private final ReferenceDataCache referenceData;

    public BlacklistSignals(ReferenceDataCache referenceData) {
        this.referenceData = referenceData;
    }

    @Override
    public String prefix() {
        return "blacklist";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Transaction txn = input.transaction();

        Map<String, String> entities = new LinkedHashMap<>();
        entities.put("account", txn.getAccountId());
        entities.put("counterparty", txn.getCounterpartyId());
        entities.put("ip", MetadataFields.ipAddress(input.metadata()).orElse(null));
        entities.put("device", MetadataFields.deviceId(input.metadata()).orElse(null));
        entities.put("email", MetadataFields.email(input.metadata()).orElse(null));

        Severity maxSeverity = null;
        List<Map<String, Object>> matches = new ArrayList<>();
        for (Map.Entry<String, String> entity : entities.entrySet()) {
            for (BlacklistEntry entry : referenceData.findActiveBlacklistEntries(
                    entity.getKey(), entity.getValue(), input.at())) {
                maxSeverity = Severity.max(maxSeverity, entry.getSeverity());
                Map<String, Object> match = new LinkedHashMap<>();
                match.put("entity_type", entity.getKey());
                match.put("entity_value", entity.getValue());
                match.put("severity", entry.getSeverity() == null ? null : entry.getSeverity().name());
                match.put("reason", entry.getReason());
                matches.add(match);
            }
        }

        out.put("is_blacklisted", !matches.isEmpty());
        out.put("max_severity", maxSeverity == null ? null : maxSeverity.name());
        out.put("match_count", (long) matches.size());
        out.put("matches", matches);
    }
}
