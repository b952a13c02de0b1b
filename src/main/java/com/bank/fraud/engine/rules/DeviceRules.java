package com.bank.fraud.engine.rules;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.engine.Rule;
import com.bank.fraud.engine.RuleSet;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Blacklist, network, device and behavioral-biometric rules.
 */
@Component
public class DeviceRules implements RuleSet {

    private final List<Rule> rules;

    public DeviceRules(MonitoringConfig config) {
        MonitoringConfig.RuleThresholds t = config.getRules();

        this.rules = List.of(
                Rule.blocking("blacklisted_entity", "blacklist", 5.0,
                        "Account, counterparty, IP, device or email matches an active blacklist entry",
                        (txn, ctx) -> ctx.isTrue("blacklist.is_blacklisted")),

                Rule.of("tor_exit_node", "network", 3.0,
                        "Transaction from a Tor exit node",
                        (txn, ctx) -> ctx.isTrue("network.is_tor")),

                Rule.of("vpn_or_proxy", "network", 1.5,
                        String.format("Transaction through a VPN or proxy (confidence >= %.2f)", t.getVpnMinConfidence()),
                        (txn, ctx) -> (ctx.isTrue("network.is_vpn") || ctx.isTrue("network.is_proxy"))
                                && ctx.atLeast("network.max_confidence", t.getVpnMinConfidence())),

                Rule.of("datacenter_ip", "network", 1.0,
                        "Transaction from a datacenter IP range",
                        (txn, ctx) -> ctx.isTrue("network.is_datacenter")),

                Rule.of("new_device", "device", 1.0,
                        "Device not seen on this account before",
                        (txn, ctx) -> ctx.isTrue("device.is_new_device")),

                Rule.of("shared_device", "device", 2.5,
                        String.format("Device used by %d+ accounts", t.getDeviceSharingAccounts()),
                        (txn, ctx) -> ctx.atLeast("device.device_account_count", t.getDeviceSharingAccounts())),

                Rule.of("fingerprint_mismatch", "device", 2.0,
                        "Device fingerprint differs from the last session on this device",
                        (txn, ctx) -> ctx.isTrue("device.fingerprint_mismatch")),

                Rule.of("emulator_or_rooted", "device", 2.0,
                        "Session from an emulator or rooted device",
                        (txn, ctx) -> ctx.isTrue("device.is_emulator") || ctx.isTrue("device.is_rooted")),

                Rule.of("behavioral_anomaly", "behavior", 2.0,
                        String.format("Session behavior deviates from the account baseline (%d+ metrics or autofill flip)",
                                t.getBehavioralMinDeviations()),
                        (txn, ctx) -> ctx.isTrue("behavior.is_behavioral_anomaly"))
        );
    }

    @Override
    public String prefix() {
        return "device";
    }

    @Override
    public List<Rule> rules() {
        return rules;
    }
}
