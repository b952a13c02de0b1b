package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.DeviceSession;
import com.bank.fraud.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Device fingerprinting: whether the device is known to the account, how many accounts
 * share it, and whether the reported fingerprint or environment looks tampered with.
 */
@Component
public class DeviceSignals implements SignalGroup {

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;

    public DeviceSignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "device";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        Transaction txn = input.transaction();
        Optional<String> deviceId = MetadataFields.deviceId(input.metadata());
        if (deviceId.isEmpty()) {
            out.unknown("device_id");
            return;
        }

        String device = deviceId.get();
        List<DeviceSession> sessions = ledger.findDeviceSessions(
                txn.getAccountId(), input.daysBack(config.getDeviceLookbackDays()), input.at());
        List<DeviceSession> onThisDevice = sessions.stream()
                .filter(s -> device.equals(s.getDeviceId()))
                .collect(Collectors.toList());

        out.put("device_id", device);
        out.put("known_device_count", sessions.stream()
                .map(DeviceSession::getDeviceId).filter(Objects::nonNull).distinct().count());
        out.put("is_new_device", onThisDevice.isEmpty());

        if (onThisDevice.isEmpty()) {
            out.unknown("device_age_days");
            out.unknown("fingerprint_mismatch");
        } else {
            // Sessions come back oldest first
            DeviceSession first = onThisDevice.get(0);
            DeviceSession last = onThisDevice.get(onThisDevice.size() - 1);
            out.put("device_age_days", SignalInput.daysBetween(first.getStartedAt(), input.at()));

            Optional<String> fingerprint = input.metadata().text("device", "fingerprint");
            if (fingerprint.isPresent() && last.getFingerprint() != null) {
                out.put("fingerprint_mismatch", !fingerprint.get().equals(last.getFingerprint()));
            } else {
                out.unknown("fingerprint_mismatch");
            }
        }

        Set<String> accounts = ledger.findDeviceSessionsByDevice(
                        device, input.daysBack(config.getDeviceSharingWindowDays()), input.at())
                .stream().map(DeviceSession::getAccountId).filter(Objects::nonNull)
                .collect(Collectors.toCollection(HashSet::new));
        accounts.add(txn.getAccountId());
        out.put("device_account_count", (long) accounts.size());

        out.put("is_emulator", input.metadata().flag("device", "is_emulator").orElse(null));
        out.put("is_rooted", input.metadata().flag("device", "is_rooted").orElse(null));
    }
}
