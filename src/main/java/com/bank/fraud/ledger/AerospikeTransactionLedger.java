package com.bank.fraud.ledger;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.bank.fraud.config.AerospikeConfig;
import com.bank.fraud.exception.LedgerUnavailableException;
import com.bank.fraud.model.Account;
import com.bank.fraud.model.AccountChange;
import com.bank.fraud.model.Beneficiary;
import com.bank.fraud.model.BeneficiaryChange;
import com.bank.fraud.model.BiometricSample;
import com.bank.fraud.model.BlacklistEntry;
import com.bank.fraud.model.DeviceSession;
import com.bank.fraud.model.Direction;
import com.bank.fraud.model.FraudFlag;
import com.bank.fraud.model.HighRiskLocation;
import com.bank.fraud.model.NetworkType;
import com.bank.fraud.model.Severity;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.VpnProxyEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Aerospike-backed ledger. Timestamps are stored as epoch-millisecond bins; embedded
 * transaction metadata is stored as the raw JSON text it was ingested with.
 *
 * Window filters run inside the scan callback, the same way the rest of the
 * Aerospike repositories filter by owner id.
 */
@Repository
public class AerospikeTransactionLedger implements TransactionLedger {

    private static final Logger log = LoggerFactory.getLogger(AerospikeTransactionLedger.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;

    public AerospikeTransactionLedger(AerospikeClient client,
                                      @Qualifier("aerospikeNamespace") String namespace,
                                      @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
    }

    @Override
    public Optional<Account> findAccount(String accountId) {
        Record record = get(AerospikeConfig.SET_ACCOUNTS, accountId);
        if (record == null) return Optional.empty();
        return Optional.of(Account.builder()
                .accountId(accountId)
                .createdAt(instant(record, "createdAt"))
                .riskTier(record.getString("riskTier"))
                .status(record.getString("status"))
                .build());
    }

    @Override
    public List<Transaction> findTransactions(String accountId, Instant after, Instant until) {
        return scan(AerospikeConfig.SET_TRANSACTIONS,
                record -> accountId.equals(record.getString("accountId"))
                        && inWindow(record, "ts", after, until),
                this::mapTransaction,
                Comparator.comparing(Transaction::getTimestamp));
    }

    @Override
    public List<Transaction> findTransactionsWithCounterparty(String accountId, String counterpartyId,
                                                              Instant after, Instant until) {
        return scan(AerospikeConfig.SET_TRANSACTIONS,
                record -> accountId.equals(record.getString("accountId"))
                        && counterpartyId.equals(record.getString("cpId"))
                        && inWindow(record, "ts", after, until),
                this::mapTransaction,
                Comparator.comparing(Transaction::getTimestamp));
    }

    @Override
    public List<Beneficiary> findBeneficiaries(String accountId, Instant after, Instant until) {
        return scan(AerospikeConfig.SET_BENEFICIARIES,
                record -> accountId.equals(record.getString("accountId"))
                        && inWindow(record, "addedAt", after, until),
                this::mapBeneficiary,
                Comparator.comparing(Beneficiary::getAddedAt));
    }

    @Override
    public Optional<Beneficiary> findBeneficiaryByCounterparty(String accountId, String counterpartyId) {
        return scan(AerospikeConfig.SET_BENEFICIARIES,
                record -> accountId.equals(record.getString("accountId"))
                        && counterpartyId.equals(record.getString("cpId")),
                this::mapBeneficiary,
                Comparator.comparing(Beneficiary::getAddedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .stream()
                .findFirst();
    }

    @Override
    public Optional<Beneficiary> findBeneficiary(String beneficiaryId) {
        Record record = get(AerospikeConfig.SET_BENEFICIARIES, beneficiaryId);
        return record == null ? Optional.empty() : Optional.of(mapBeneficiary(record));
    }

    @Override
    public List<BeneficiaryChange> findBeneficiaryChanges(String beneficiaryId, Instant after, Instant until) {
        return scan(AerospikeConfig.SET_BENEFICIARY_CHANGES,
                record -> beneficiaryId.equals(record.getString("beneId"))
                        && inWindow(record, "changedAt", after, until),
                record -> BeneficiaryChange.builder()
                        .changeId(record.getString("changeId"))
                        .beneficiaryId(record.getString("beneId"))
                        .changeType(record.getString("changeType"))
                        .changedAt(instant(record, "changedAt"))
                        .verified(record.getBoolean("verified"))
                        .changeSource(record.getString("source"))
                        .requestorName(record.getString("requestor"))
                        .build(),
                Comparator.comparing(BeneficiaryChange::getChangedAt));
    }

    @Override
    public List<AccountChange> findAccountChanges(String accountId, Instant after, Instant until) {
        return scan(AerospikeConfig.SET_ACCOUNT_CHANGES,
                record -> accountId.equals(record.getString("accountId"))
                        && inWindow(record, "changedAt", after, until),
                record -> AccountChange.builder()
                        .changeId(record.getString("changeId"))
                        .accountId(record.getString("accountId"))
                        .changeType(lower(record.getString("changeType")))
                        .changedAt(instant(record, "changedAt"))
                        .channel(record.getString("channel"))
                        .build(),
                Comparator.comparing(AccountChange::getChangedAt));
    }

    @Override
    public List<DeviceSession> findDeviceSessions(String accountId, Instant after, Instant until) {
        return scan(AerospikeConfig.SET_DEVICE_SESSIONS,
                record -> accountId.equals(record.getString("accountId"))
                        && inWindow(record, "startedAt", after, until),
                this::mapDeviceSession,
                Comparator.comparing(DeviceSession::getStartedAt));
    }

    @Override
    public List<DeviceSession> findDeviceSessionsByDevice(String deviceId, Instant after, Instant until) {
        return scan(AerospikeConfig.SET_DEVICE_SESSIONS,
                record -> deviceId.equals(record.getString("deviceId"))
                        && inWindow(record, "startedAt", after, until),
                this::mapDeviceSession,
                Comparator.comparing(DeviceSession::getStartedAt));
    }

    @Override
    public List<BiometricSample> findBiometricSamples(String accountId, Instant after, Instant until) {
        return scan(AerospikeConfig.SET_BIOMETRIC_SAMPLES,
                record -> accountId.equals(record.getString("accountId"))
                        && inWindow(record, "capturedAt", after, until),
                record -> BiometricSample.builder()
                        .sampleId(record.getString("sampleId"))
                        .accountId(record.getString("accountId"))
                        .capturedAt(instant(record, "capturedAt"))
                        .typingSpeed(nullableDouble(record, "typingSpeed"))
                        .sessionDurationSeconds(nullableDouble(record, "sessionSecs"))
                        .mouseSpeed(nullableDouble(record, "mouseSpeed"))
                        .copyPasteCount(nullableDouble(record, "copyPaste"))
                        .autofillUsed(nullableBoolean(record, "autofill"))
                        .build(),
                Comparator.comparing(BiometricSample::getCapturedAt));
    }

    @Override
    public List<FraudFlag> findFraudFlags(String entityType, String entityId, Instant after, Instant until) {
        return scan(AerospikeConfig.SET_FRAUD_FLAGS,
                record -> entityId.equals(record.getString("entityId"))
                        && entityType.equalsIgnoreCase(record.getString("entityType"))
                        && inWindow(record, "flaggedAt", after, until),
                record -> FraudFlag.builder()
                        .flagId(record.getString("flagId"))
                        .entityId(record.getString("entityId"))
                        .entityType(lower(record.getString("entityType")))
                        .flaggedAt(instant(record, "flaggedAt"))
                        .severity(Severity.fromString(record.getString("severity")))
                        .confirmed(record.getBoolean("confirmed"))
                        .reason(record.getString("reason"))
                        .build(),
                Comparator.comparing(FraudFlag::getFlaggedAt));
    }

    @Override
    public List<BlacklistEntry> findAllBlacklistEntries() {
        return scan(AerospikeConfig.SET_BLACKLIST,
                record -> record.getString("entityValue") != null,
                record -> BlacklistEntry.builder()
                        .entryId(record.getString("entryId"))
                        .entityType(lower(record.getString("entityType")))
                        .entityValue(record.getString("entityValue"))
                        .severity(Severity.fromString(record.getString("severity")))
                        .reason(record.getString("reason"))
                        .active(record.getBoolean("active"))
                        .addedAt(instant(record, "addedAt"))
                        .expiresAt(instant(record, "expiresAt"))
                        .build(),
                Comparator.comparing(BlacklistEntry::getEntryId, Comparator.nullsLast(Comparator.naturalOrder())));
    }

    @Override
    public List<VpnProxyEntry> findAllVpnProxyEntries() {
        return scan(AerospikeConfig.SET_VPN_PROXY,
                record -> record.getString("ipPrefix") != null,
                record -> VpnProxyEntry.builder()
                        .ipPrefix(record.getString("ipPrefix"))
                        .networkType(NetworkType.fromString(record.getString("netType")))
                        .provider(record.getString("provider"))
                        .confidence(record.getDouble("confidence"))
                        .active(record.getBoolean("active"))
                        .build(),
                Comparator.comparing(VpnProxyEntry::getIpPrefix));
    }

    @Override
    public List<HighRiskLocation> findAllHighRiskLocations() {
        return scan(AerospikeConfig.SET_HIGH_RISK_LOCATIONS,
                record -> record.getString("country") != null,
                record -> HighRiskLocation.builder()
                        .country(record.getString("country"))
                        .city(record.getString("city"))
                        .severity(Severity.fromString(record.getString("severity")))
                        .sanctioned(record.getBoolean("sanctioned"))
                        .embargoed(record.getBoolean("embargoed"))
                        .highFraudRate(record.getBoolean("highFraudRate"))
                        .blockByDefault(record.getBoolean("blockDefault"))
                        .reason(record.getString("reason"))
                        .build(),
                Comparator.comparing(HighRiskLocation::getCountry)
                        .thenComparing(HighRiskLocation::getCity, Comparator.nullsFirst(Comparator.naturalOrder())));
    }

    private Record get(String set, String id) {
        try {
            return client.get(readPolicy, new Key(namespace, set, id));
        } catch (AerospikeException e) {
            throw new LedgerUnavailableException("Ledger read failed for " + set + "/" + id, e);
        }
    }

    private <T> List<T> scan(String set, Predicate<Record> filter, Function<Record, T> mapper,
                             Comparator<T> order) {
        List<T> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        try {
            client.scanAll(scanPolicy, namespace, set, (key, record) -> {
                if (!filter.test(record)) return;
                T mapped = mapper.apply(record);
                synchronized (results) {
                    results.add(mapped);
                }
            });
        } catch (AerospikeException e) {
            throw new LedgerUnavailableException("Ledger scan failed for set " + set, e);
        }

        results.removeIf(Objects::isNull);
        results.sort(order);
        log.trace("Scanned {} matching records from {}", results.size(), set);
        return results;
    }

    private Transaction mapTransaction(Record record) {
        return Transaction.builder()
                .transactionId(record.getString("txnId"))
                .accountId(record.getString("accountId"))
                .counterpartyId(record.getString("cpId"))
                .amount(record.getDouble("amount"))
                .direction(Direction.fromString(record.getString("direction")))
                .transactionType(record.getString("txnType"))
                .timestamp(instant(record, "ts"))
                .description(record.getString("descr"))
                .metadata(record.getString("metadata"))
                .build();
    }

    private Beneficiary mapBeneficiary(Record record) {
        return Beneficiary.builder()
                .beneficiaryId(record.getString("beneId"))
                .accountId(record.getString("accountId"))
                .counterpartyId(record.getString("cpId"))
                .name(record.getString("name"))
                .addedAt(instant(record, "addedAt"))
                .addedBy(record.getString("addedBy"))
                .additionSource(record.getString("source"))
                .ipAddress(record.getString("ipAddress"))
                .verified(record.getBoolean("verified"))
                .lastPaymentAt(instant(record, "lastPaymentAt"))
                .build();
    }

    private DeviceSession mapDeviceSession(Record record) {
        return DeviceSession.builder()
                .sessionId(record.getString("sessionId"))
                .accountId(record.getString("accountId"))
                .deviceId(record.getString("deviceId"))
                .fingerprint(record.getString("fingerprint"))
                .ipAddress(record.getString("ipAddress"))
                .userAgent(record.getString("userAgent"))
                .startedAt(instant(record, "startedAt"))
                .build();
    }

    private static boolean inWindow(Record record, String bin, Instant after, Instant until) {
        Object value = record.getValue(bin);
        if (!(value instanceof Number)) return false;
        long millis = ((Number) value).longValue();
        return millis > after.toEpochMilli() && millis <= until.toEpochMilli();
    }

    private static Instant instant(Record record, String bin) {
        Object value = record.getValue(bin);
        return value instanceof Number ? Instant.ofEpochMilli(((Number) value).longValue()) : null;
    }

    private static Double nullableDouble(Record record, String bin) {
        Object value = record.getValue(bin);
        return value instanceof Number ? ((Number) value).doubleValue() : null;
    }

    private static Boolean nullableBoolean(Record record, String bin) {
        Object value = record.getValue(bin);
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof Number) return ((Number) value).longValue() != 0;
        return null;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
