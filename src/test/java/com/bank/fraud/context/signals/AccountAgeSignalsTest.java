package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.Context;
import com.bank.fraud.context.SignalHarness;
import com.bank.fraud.testutil.InMemoryTransactionLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.bank.fraud.testutil.TestDataFactory.NOW;
import static com.bank.fraud.testutil.TestDataFactory.createAccount;
import static com.bank.fraud.testutil.TestDataFactory.credit;
import static com.bank.fraud.testutil.TestDataFactory.daysAgo;
import static com.bank.fraud.testutil.TestDataFactory.hoursAgo;
import static org.assertj.core.api.Assertions.assertThat;

class AccountAgeSignalsTest {

    private InMemoryTransactionLedger ledger;
    private AccountAgeSignals signals;

    @BeforeEach
    void setUp() {
        ledger = new InMemoryTransactionLedger();
        signals = new AccountAgeSignals(ledger, new MonitoringConfig());
    }

    @Test
    void accountOpenedHoursAgo_brandNewAndCritical() {
        ledger.account(createAccount("A1", hoursAgo(5)));

        Context ctx = SignalHarness.run(signals, credit("T1", "A1", 50_000, NOW));

        assertThat(ctx.isTrue("account.account_found")).isTrue();
        assertThat(ctx.isTrue("account.is_brand_new_account")).isTrue();
        assertThat(ctx.text("account.account_age_risk_level")).contains("critical");
        assertThat(ctx.isTrue("account.is_large_tx_young_account")).isTrue();
    }

    @Test
    void matureAccount_minimalRisk() {
        ledger.account(createAccount("A1", daysAgo(800)));

        Context ctx = SignalHarness.run(signals, credit("T1", "A1", 50_000, NOW));

        assertThat(ctx.isFalse("account.is_young_account")).isTrue();
        assertThat(ctx.text("account.account_age_risk_level")).contains("minimal");
        assertThat(ctx.isFalse("account.is_large_tx_young_account")).isTrue();
    }

    @Test
    void unknownAccount_ageSignalsUnknown() {
        Context ctx = SignalHarness.run(signals, credit("T1", "A1", 50_000, NOW));

        assertThat(ctx.isFalse("account.account_found")).isTrue();
        assertThat(ctx.has("account.is_brand_new_account")).isFalse();
    }

    @Test
    void riskLevel_buckets() {
        assertThat(signals.riskLevel(3)).isEqualTo("critical");
        assertThat(signals.riskLevel(7)).isEqualTo("high");
        assertThat(signals.riskLevel(45)).isEqualTo("medium");
        assertThat(signals.riskLevel(200)).isEqualTo("low");
        assertThat(signals.riskLevel(365)).isEqualTo("minimal");
    }
}
