package com.bank.fraud.context;

import com.bank.fraud.config.MetricsConfig;
import com.bank.fraud.config.MonitoringConfig;
import com.bank.fraud.exception.InvalidTransactionException;
import com.bank.fraud.exception.MetadataParseException;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TransactionMetadata;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds the evaluation {@link Context} for a transaction by running every registered
 * {@link SignalGroup}.
 *
 * Groups run on the signal executor, all at once in parallel mode or one after another
 * otherwise. A group that overruns its budget (or the overall deadline) is cancelled and its signals are left
 * out, so its rules see "unknown"; the prefix is listed under
 * {@code context.degraded_groups}. Any exception thrown by a group, including
 * {@link com.bank.fraud.exception.LedgerUnavailableException}, aborts the build.
 */
@Component
public class ContextAssembler {

    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    public static final String RESERVED_PREFIX = "context";
    public static final String DEGRADED_GROUPS = RESERVED_PREFIX + ".degraded_groups";

    private final List<SignalGroup> groups;
    private final MonitoringConfig.Assembly settings;
    private final ExecutorService executor;
    private final MetricsConfig metricsConfig;

    public ContextAssembler(List<SignalGroup> groups,
                            MonitoringConfig config,
                            @Qualifier("signalExecutor") ExecutorService executor,
                            MetricsConfig metricsConfig) {
        this.groups = new ArrayList<>(groups);
        this.groups.sort(Comparator.comparing(SignalGroup::prefix));
        this.settings = config.getAssembly();
        this.executor = executor;
        this.metricsConfig = metricsConfig;

        Set<String> prefixes = new HashSet<>();
        for (SignalGroup group : this.groups) {
            String prefix = group.prefix();
            if (prefix == null || prefix.isBlank() || prefix.contains(".")) {
                throw new IllegalStateException("Invalid signal group prefix: '" + prefix + "'");
            }
            if (RESERVED_PREFIX.equals(prefix) || !prefixes.add(prefix)) {
                throw new IllegalStateException("Signal group prefix already in use: " + prefix);
            }
            log.info("Registered signal group: {} -> {}", prefix, group.getClass().getSimpleName());
        }
    }

    /**
     * Assemble the context for one transaction.
     *
     * @throws InvalidTransactionException if the transaction's own metadata is unreadable
     */
    @Observed(name = "context.build", contextualName = "build-context")
    public Context build(Transaction txn) {
        TransactionMetadata metadata;
        try {
            metadata = TransactionMetadata.parse(txn.getMetadata());
        } catch (MetadataParseException e) {
            throw new InvalidTransactionException(
                    "Transaction " + txn.getTransactionId() + " has unreadable metadata", e);
        }
        SignalInput input = new SignalInput(txn, metadata);

        Map<String, Object> merged = new LinkedHashMap<>();
        List<String> degraded = new ArrayList<>();

        if (settings.isParallel()) {
            runParallel(input, merged, degraded);
        } else {
            runSequential(input, merged, degraded);
        }

        merged.put(DEGRADED_GROUPS, List.copyOf(degraded));
        return new Context(merged);
    }

    public List<String> getGroupPrefixes() {
        return groups.stream().map(SignalGroup::prefix).toList();
    }

    private void runSequential(SignalInput input, Map<String, Object> merged, List<String> degraded) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.getDeadlineMs());
        long groupBudget = TimeUnit.MILLISECONDS.toNanos(settings.getGroupTimeoutMs());
        for (SignalGroup group : groups) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                markDegraded(group, input, degraded, "evaluation deadline passed before group started");
                continue;
            }
            Future<SignalWriter> future = executor.submit(() -> runGroup(group, input));
            try {
                collect(group, future, Math.min(groupBudget, remaining), input, merged, degraded);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while assembling context for "
                        + input.transaction().getTransactionId(), e);
            }
        }
    }

    private void runParallel(SignalInput input, Map<String, Object> merged, List<String> degraded) {
        long start = System.nanoTime();
        long deadline = start + TimeUnit.MILLISECONDS.toNanos(settings.getDeadlineMs());
        long groupDeadline = start + TimeUnit.MILLISECONDS.toNanos(settings.getGroupTimeoutMs());
        long waitUntil = Math.min(deadline, groupDeadline);

        Map<SignalGroup, Future<SignalWriter>> futures = new LinkedHashMap<>();
        for (SignalGroup group : groups) {
            futures.put(group, executor.submit(() -> runGroup(group, input)));
        }

        try {
            for (Map.Entry<SignalGroup, Future<SignalWriter>> entry : futures.entrySet()) {
                long remaining = Math.max(0L, waitUntil - System.nanoTime());
                collect(entry.getKey(), entry.getValue(), remaining, input, merged, degraded);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while assembling context for "
                    + input.transaction().getTransactionId(), e);
        } finally {
            futures.values().forEach(f -> f.cancel(true));
        }
    }

    /**
     * Wait up to {@code waitNanos} for one group. A timeout cancels the group and marks it
     * degraded; an exception from the group is rethrown.
     */
    private void collect(SignalGroup group, Future<SignalWriter> future, long waitNanos, SignalInput input,
                         Map<String, Object> merged, List<String> degraded) throws InterruptedException {
        try {
            merge(merged, future.get(waitNanos, TimeUnit.NANOSECONDS));
        } catch (TimeoutException | CancellationException e) {
            future.cancel(true);
            markDegraded(group, input, degraded, "exceeded time budget");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Signal group " + group.prefix() + " failed", cause);
        }
    }

    private SignalWriter runGroup(SignalGroup group, SignalInput input) {
        SignalWriter writer = new SignalWriter(group.prefix());
        group.contribute(input, writer);
        return writer;
    }

    private void merge(Map<String, Object> merged, SignalWriter writer) {
        for (Map.Entry<String, Object> e : writer.values().entrySet()) {
            if (merged.containsKey(e.getKey())) {
                throw new IllegalStateException("Duplicate signal key: " + e.getKey());
            }
            merged.put(e.getKey(), e.getValue());
        }
    }

    private void markDegraded(SignalGroup group, SignalInput input, List<String> degraded, String why) {
        degraded.add(group.prefix());
        metricsConfig.recordDegradedGroup(group.prefix());
        log.warn("Signal group {} degraded for txn {}: {}",
                group.prefix(), input.transaction().getTransactionId(), why);
    }
}
