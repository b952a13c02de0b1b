package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalMath;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.BiometricSample;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Behavioral biometrics of the current session against the account's baseline.
 *
 * Each metric is scored as |current - mean| / stddev once the baseline has enough
 * samples. Autofill usage is a yes/no habit, so it is checked for an inversion of an
 * established pattern instead.
 */
@Component
public class BehavioralSignals implements SignalGroup {

    private static final Map<String, Function<BiometricSample, Double>> METRICS = new LinkedHashMap<>();

    static {
        METRICS.put("typing_speed", BiometricSample::getTypingSpeed);
        METRICS.put("session_duration", BiometricSample::getSessionDurationSeconds);
        METRICS.put("mouse_speed", BiometricSample::getMouseSpeed);
        METRICS.put("copy_paste_count", BiometricSample::getCopyPasteCount);
    }

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;
    private final int minDeviations;

    public BehavioralSignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
        this.minDeviations = config.getRules().getBehavioralMinDeviations();
    }

    @Override
    public String prefix() {
        return "behavior";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        if (!input.metadata().has("behavior")) {
            out.unknown("is_behavioral_anomaly");
            return;
        }

        List<BiometricSample> samples = ledger.findBiometricSamples(
                input.transaction().getAccountId(), input.daysBack(config.getBiometricLookbackDays()), input.at());
        out.put("baseline_sample_count", (long) samples.size());

        List<String> deviations = new ArrayList<>();
        Double maxZ = null;
        for (Map.Entry<String, Function<BiometricSample, Double>> metric : METRICS.entrySet()) {
            String name = metric.getKey();
            Optional<Double> current = input.metadata().number("behavior", name);
            List<Double> baseline = samples.stream()
                    .map(metric.getValue()).filter(Objects::nonNull)
                    .collect(Collectors.toList());
            if (current.isEmpty() || baseline.size() < config.getBiometricMinSamples()) {
                out.unknown(name + "_z_score");
                continue;
            }

            double mean = SignalMath.mean(baseline).getAsDouble();
            double stdDev = SignalMath.populationStdDev(baseline).getAsDouble();
            OptionalDouble z = SignalMath.zScore(current.get(), mean, stdDev);
            if (z.isEmpty()) {
                // A constant baseline has no spread to measure against
                out.unknown(name + "_z_score");
                continue;
            }
            out.put(name + "_z_score", z.getAsDouble());
            maxZ = maxZ == null ? z.getAsDouble() : Math.max(maxZ, z.getAsDouble());
            if (z.getAsDouble() > config.getBiometricZThreshold()) {
                deviations.add(name);
            }
        }

        Boolean autofillFlip = autofillFlip(input, samples);

        out.put("deviations", deviations);
        out.put("deviation_count", (long) deviations.size());
        out.put("max_z_score", maxZ);
        out.put("autofill_flip", autofillFlip);
        out.put("is_behavioral_anomaly",
                deviations.size() >= minDeviations || Boolean.TRUE.equals(autofillFlip));
    }

    private Boolean autofillFlip(SignalInput input, List<BiometricSample> samples) {
        Optional<Boolean> current = input.metadata().flag("behavior", "autofill_used");
        List<Boolean> history = samples.stream()
                .map(BiometricSample::getAutofillUsed).filter(Objects::nonNull)
                .collect(Collectors.toList());
        if (current.isEmpty() || history.size() < config.getBiometricMinSamples()) {
            return null;
        }
        double share = (double) history.stream().filter(Boolean::booleanValue).count() / history.size();
        if (share >= config.getAutofillHighShare()) return !current.get();
        if (share <= config.getAutofillLowShare()) return current.get();
        return false;
    }
}
