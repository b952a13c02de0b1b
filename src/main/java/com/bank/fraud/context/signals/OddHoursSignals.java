package com.bank.fraud.context.signals;

import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.context.SignalGroup;
import com.bank.fraud.context.SignalInput;
import com.bank.fraud.context.SignalWriter;
import com.bank.fraud.ledger.TransactionLedger;
import com.bank.fraud.model.Transaction;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Time-of-day and weekend activity, judged against the account's own habits rather than
 * only a global clock rule. The personal comparison needs a minimum amount of history.
 */
@Component
public class OddHoursSignals implements SignalGroup {

    private final TransactionLedger ledger;
    private final MonitoringConfig.Signals config;

    public OddHoursSignals(TransactionLedger ledger, MonitoringConfig config) {
        this.ledger = ledger;
        this.config = config.getSignals();
    }

    @Override
    public String prefix() {
        return "timing";
    }

    @Override
    public void contribute(SignalInput input, SignalWriter out) {
        ZoneId zone = ZoneId.of(config.getTimezone());
        int hour = input.at().atZone(zone).getHour();
        boolean oddHour = isOddHour(hour, config.getOddHoursStart(), config.getOddHoursEnd());
        boolean weekend = isWeekend(input.at(), zone);

        out.put("hour", (long) hour);
        out.put("is_odd_hour", oddHour);
        out.put("is_weekend", weekend);

        List<Transaction> history = input.priorOnly(ledger.findTransactions(
                input.transaction().getAccountId(), input.daysBack(config.getTimingLookbackDays()), input.at()));
        out.put("history_sample_size", (long) history.size());

        if (history.size() < config.getMinTimingSamples()) {
            out.unknown("historical_odd_hour_ratio");
            out.unknown("historical_weekend_ratio");
            out.unknown("deviates_from_hour_pattern");
            out.unknown("deviates_from_weekend_pattern");
            return;
        }

        long oddCount = history.stream()
                .filter(t -> isOddHour(t.getTimestamp().atZone(zone).getHour(),
                        config.getOddHoursStart(), config.getOddHoursEnd()))
                .count();
        long weekendCount = history.stream().filter(t -> isWeekend(t.getTimestamp(), zone)).count();
        double oddRatio = (double) oddCount / history.size();
        double weekendRatio = (double) weekendCount / history.size();

        out.put("historical_odd_hour_ratio", oddRatio);
        out.put("historical_weekend_ratio", weekendRatio);
        out.put("deviates_from_hour_pattern", oddHour && oddRatio < config.getPatternDeviationRatio());
        out.put("deviates_from_weekend_pattern", weekend && weekendRatio < config.getPatternDeviationRatio());
    }

    /**
     * Whether the hour falls in [start, end). A start later than the end wraps past midnight.
     */
    static boolean isOddHour(int hour, int start, int end) {
        if (start == end) return false;
        if (start > end) {
            return hour >= start || hour < end;
        }
        return hour >= start && hour < end;
    }

    static boolean isWeekend(Instant at, ZoneId zone) {
        DayOfWeek day = ZonedDateTime.ofInstant(at, zone).getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
