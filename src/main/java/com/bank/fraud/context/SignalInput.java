package com.bank.fraud.context;

import com.bank.fraud.exception.MetadataParseException;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TransactionMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The transaction under evaluation, its parsed metadata, and the reference instant that
 * all windows are measured back from (the transaction's own timestamp).
 */
public final class SignalInput {

    private static final Logger log = LoggerFactory.getLogger(SignalInput.class);

    private final Transaction transaction;
    private final TransactionMetadata metadata;
    private final Instant at;

    public SignalInput(Transaction transaction, TransactionMetadata metadata) {
        this.transaction = transaction;
        this.metadata = metadata;
        this.at = transaction.getTimestamp();
    }

    public Transaction transaction() {
        return transaction;
    }

    public TransactionMetadata metadata() {
        return metadata;
    }

    public Instant at() {
        return at;
    }

    public Instant hoursBack(long hours) {
        return at.minus(Duration.ofHours(hours));
    }

    public Instant daysBack(long days) {
        return at.minus(Duration.ofDays(days));
    }

    /**
     * Whether a ledger record counts as history for this evaluation: not the transaction
     * itself and not later than it.
     */
    public boolean isPrior(Transaction other) {
        return other.getTimestamp() != null
                && !other.getTimestamp().isAfter(at)
                && !transaction.getTransactionId().equals(other.getTransactionId());
    }

    public List<Transaction> priorOnly(List<Transaction> records) {
        return records.stream().filter(this::isPrior).collect(Collectors.toList());
    }

    /**
     * Metadata of a historical record. An unparsable record is skipped for the calling
     * group and logged; it never aborts the evaluation.
     */
    public Optional<TransactionMetadata> metadataOf(Transaction historical, String group) {
        try {
            return Optional.of(TransactionMetadata.parse(historical.getMetadata()));
        } catch (MetadataParseException e) {
            log.warn("Skipping transaction {} in signal group {}: {}",
                    historical.getTransactionId(), group, e.getMessage());
            return Optional.empty();
        }
    }

    public static double hoursBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 3_600_000.0;
    }

    public static double daysBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / 86_400_000.0;
    }
}
