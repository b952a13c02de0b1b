package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.Account;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class AccountAgeSignals implements SignalGroup {

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;

    public AccountAgeSignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "account";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Optional<Account> account = ledger.findAccount(input.transaction().getAccountId());
        out.put("account_found", account.isPresent());
        if (account.isEmpty()) {
            return;
        }

        out.put("account_risk_tier", account.get().getRiskTier());
        out.put("account_status", account.get().getStatus());
        if (account.get().getCreatedAt() == null) {
            return;
        }

        double ageDays = Math.max(0.0, SignalInput.daysBetween(account.get().getCreatedAt(), input.at()));
        boolean young = ageDays < config.getYoungAccountDays();

        out.put("account_age_days", ageDays);
        out.put("is_brand_new_account", ageDays < config.getBrandNewAccountDays());
        out.put("account_age_risk_level", riskLevel(ageDays));
        out.put("is_young_account", young);
        out.put("is_large_tx_young_account",
                young && input.transaction().getAmount() >= config.getLargeTransactionAmount());
    }

    String riskLevel(double ageDays) {
        if (ageDays < config.getCriticalAccountAgeDays()) return "critical";
        if (ageDays < config.getHighRiskAccountAgeDays()) return "high";
        if (ageDays < config.getMediumRiskAccountAgeDays()) return "medium";
        if (ageDays < config.getLowRiskAccountAgeDays()) return "low";
        return "minimal";
    }
}
