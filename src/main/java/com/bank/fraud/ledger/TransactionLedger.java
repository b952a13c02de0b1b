package com.bank.fraud.ledger;

import com.bank.fraud.model.Account;
import com.bank.fraud.model.AccountChange;
import com.bank.fraud.model.Beneficiary;
import com.bank.fraud.model.BeneficiaryChange;
import com.bank.fraud.model.BiometricSample;
import com.bank.fraud.model.BlacklistEntry;
import com.bank.fraud.model.DeviceSession;
import com.bank.fraud.model.FraudFlag;
import com.bank.fraud.model.HighRiskLocation;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.VpnProxyEntry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only query surface over the transaction ledger and its reference tables.
 *
 * Time-windowed queries take an exclusive lower bound ({@code after}) and an inclusive
 * upper bound ({@code until}) and return records ordered by timestamp ascending.
 * Implementations throw {@link com.bank.fraud.exception.LedgerUnavailableException}
 * when the store cannot be reached; they never return partial results in that case.
 */
public interface TransactionLedger {

    Optional<Account> findAccount(String accountId);

    List<Transaction> findTransactions(String accountId, Instant after, Instant until);

    List<Transaction> findTransactionsWithCounterparty(String accountId, String counterpartyId,
                                                       Instant after, Instant until);

    List<Beneficiary> findBeneficiaries(String accountId, Instant after, Instant until);

    Optional<Beneficiary> findBeneficiaryByCounterparty(String accountId, String counterpartyId);

    Optional<Beneficiary> findBeneficiary(String beneficiaryId);

    List<BeneficiaryChange> findBeneficiaryChanges(String beneficiaryId, Instant after, Instant until);

    List<AccountChange> findAccountChanges(String accountId, Instant after, Instant until);

    List<DeviceSession> findDeviceSessions(String accountId, Instant after, Instant until);

    List<DeviceSession> findDeviceSessionsByDevice(String deviceId, Instant after, Instant until);

    List<BiometricSample> findBiometricSamples(String accountId, Instant after, Instant until);

    List<FraudFlag> findFraudFlags(String entityType, String entityId, Instant after, Instant until);

    List<BlacklistEntry> findAllBlacklistEntries();

    List<VpnProxyEntry> findAllVpnProxyEntries();

    List<HighRiskLocation> findAllHighRiskLocations();
}
