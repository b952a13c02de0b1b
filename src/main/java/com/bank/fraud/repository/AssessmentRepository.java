package com.bank.fraud.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.fraud.config.AerospikeConfig;
import com.bank.fraud.exception.AssessmentPersistenceException;
import com.bank.fraud.model.AssessmentResult;
import com.bank.fraud.model.Decision;
import com.bank.fraud.model.ReviewStatus;
import com.bank.fraud.model.RiskLevel;
import com.bank.fraud.model.TriggeredRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Assessments keyed by transaction id. The pipeline writes each one exactly once; the
 * review fields are the only ones changed afterwards, and only while the assessment is
 * still pending.
 */
@Repository
public class AssessmentRepository {

    private static final Logger log = LoggerFactory.getLogger(AssessmentRepository.class);

    private static final TypeReference<List<TriggeredRule>> TRIGGERED_LIST = new TypeReference<>() {};

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy createOnlyPolicy;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AssessmentRepository(AerospikeClient client,
                                @Qualifier("aerospikeNamespace") String namespace,
                                @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy,
                                @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.createOnlyPolicy = createOnlyPolicy;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Store the assessment unless one already exists for the transaction.
     *
     * @return the assessment now stored: the argument, or the earlier record on a retry
     */
    public AssessmentResult insertOnce(AssessmentResult result) {
        Key key = key(result.getTransactionId());
        try {
            client.put(createOnlyPolicy, key,
                    new Bin("assessmentId", result.getAssessmentId()),
                    new Bin("txnId", result.getTransactionId()),
                    new Bin("accountId", result.getAccountId()),
                    new Bin("riskScore", result.getRiskScore()),
                    new Bin("riskLevel", result.getRiskLevel().name()),
                    new Bin("decision", result.getDecision().name()),
                    new Bin("reviewStatus", result.getReviewStatus().name()),
                    new Bin("triggered", serialize(result.getTriggeredRules())),
                    new Bin("scoringVer", result.getScoringVersion()),
                    new Bin("createdAt", result.getCreatedAt().toEpochMilli()));
            return result;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                log.info("Assessment for txn {} already stored, returning existing record", result.getTransactionId());
                return findByTransactionId(result.getTransactionId())
                        .orElseThrow(() -> new AssessmentPersistenceException(
                                "Assessment for txn " + result.getTransactionId() + " exists but cannot be read", e));
            }
            throw new AssessmentPersistenceException(
                    "Failed to store assessment for txn " + result.getTransactionId(), e);
        }
    }

    public Optional<AssessmentResult> findByTransactionId(String transactionId) {
        Record record;
        try {
            record = client.get(readPolicy, key(transactionId));
        } catch (AerospikeException e) {
            throw new AssessmentPersistenceException("Failed to read assessment for txn " + transactionId, e);
        }
        return record == null ? Optional.empty() : Optional.of(mapRecord(record));
    }

    public Optional<AssessmentResult> findByAssessmentId(String assessmentId) {
        List<AssessmentResult> matches = scan(record -> assessmentId.equals(record.getString("assessmentId")));
        return matches.stream().findFirst();
    }

    /**
     * Oldest pending assessments first.
     */
    public List<AssessmentResult> findPendingReview(int limit) {
        List<AssessmentResult> pending = scan(record ->
                ReviewStatus.PENDING.name().equals(record.getString("reviewStatus")));
        pending.sort(Comparator.comparing(AssessmentResult::getCreatedAt));
        if (pending.size() > limit) {
            return new ArrayList<>(pending.subList(0, limit));
        }
        return pending;
    }

    /**
     * Record an analyst's review. Only a PENDING assessment can be reviewed; the write is
     * conditional on the generation that was read, so two concurrent reviews cannot both win.
     *
     * @return true if the review was applied
     */
    public boolean updateReview(String transactionId, ReviewStatus status, String notes, String reviewerId) {
        if (status == ReviewStatus.PENDING) {
            throw new IllegalArgumentException("A review must move the assessment out of PENDING");
        }
        Key key = key(transactionId);
        try {
            Record record = client.get(readPolicy, key);
            if (record == null) {
                log.warn("Review for unknown assessment txn {}", transactionId);
                return false;
            }
            if (!ReviewStatus.PENDING.name().equals(record.getString("reviewStatus"))) {
                log.info("Assessment for txn {} already reviewed ({}), ignoring update",
                        transactionId, record.getString("reviewStatus"));
                return false;
            }

            WritePolicy conditional = new WritePolicy(writePolicy);
            conditional.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
            conditional.generation = record.generation;

            client.put(conditional, key,
                    new Bin("reviewStatus", status.name()),
                    new Bin("reviewNotes", notes),
                    new Bin("reviewerId", reviewerId),
                    new Bin("reviewedAt", Instant.now().toEpochMilli()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.info("Assessment for txn {} changed concurrently, review not applied", transactionId);
                return false;
            }
            throw new AssessmentPersistenceException("Failed to update review for txn " + transactionId, e);
        }
    }

    private List<AssessmentResult> scan(java.util.function.Predicate<Record> filter) {
        List<AssessmentResult> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        try {
            client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ASSESSMENTS,
                    (key, record) -> {
                        if (filter.test(record)) {
                            AssessmentResult mapped = mapRecord(record);
                            synchronized (results) {
                                results.add(mapped);
                            }
                        }
                    });
        } catch (AerospikeException e) {
            throw new AssessmentPersistenceException("Failed to scan assessments", e);
        }
        return results;
    }

    private Key key(String transactionId) {
        return new Key(namespace, AerospikeConfig.SET_ASSESSMENTS, transactionId);
    }

    private AssessmentResult mapRecord(Record record) {
        return AssessmentResult.builder()
                .assessmentId(record.getString("assessmentId"))
                .transactionId(record.getString("txnId"))
                .accountId(record.getString("accountId"))
                .riskScore(record.getDouble("riskScore"))
                .riskLevel(RiskLevel.valueOf(record.getString("riskLevel")))
                .decision(Decision.valueOf(record.getString("decision")))
                .reviewStatus(ReviewStatus.valueOf(record.getString("reviewStatus")))
                .triggeredRules(deserialize(record.getString("triggered")))
                .scoringVersion(record.getString("scoringVer"))
                .createdAt(Instant.ofEpochMilli(record.getLong("createdAt")))
                .reviewNotes(record.getString("reviewNotes"))
                .reviewerId(record.getString("reviewerId"))
                .reviewedAt(record.getValue("reviewedAt") == null ? null
                        : Instant.ofEpochMilli(record.getLong("reviewedAt")))
                .build();
    }

    private String serialize(List<TriggeredRule> rules) {
        try {
            return objectMapper.writeValueAsString(rules);
        } catch (JsonProcessingException e) {
            throw new AssessmentPersistenceException("Failed to serialize triggered rules", e);
        }
    }

    private List<TriggeredRule> deserialize(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, TRIGGERED_LIST);
        } catch (JsonProcessingException e) {
            throw new AssessmentPersistenceException("Stored triggered rules are unreadable", e);
        }
    }
}
