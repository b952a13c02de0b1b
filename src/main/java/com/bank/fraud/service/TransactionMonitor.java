package com.bank.fraud.service;

import com.bank.fraud.config.MetricsConfig;
import com.bank.fraud.context.Context;
import com.bank.fraud.context.ContextAssembler;
import com.bank.fraud.engine.RuleEvaluator;
import com.bank.fraud.exception.AssessmentPersistenceException;
import com.bank.fraud.exception.InvalidTransactionException;
import com.bank.fraud.exception.LedgerUnavailableException;
import com.bank.fraud.exception.MalformedContextException;
import com.bank.fraud.model.AssessmentResult;
import com.bank.fraud.model.Decision;
import com.bank.fraud.model.Transaction;
import com.bank.fraud.model.TriggeredRule;
import com.bank.fraud.repository.AssessmentRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point of the monitoring pipeline.
 *
 * Flow:
 * 1. Validate the transaction
 * 2. Return the stored assessment if this transaction was already evaluated
 * 3. Assemble the signal context from the ledger
 * 4. Run the rule catalog
 * 5. Score and decide
 * 6. Persist the assessment (create-only)
 *
 * Any failure along the way propagates; nothing is persisted from a partial evaluation.
 */
@Service
public class TransactionMonitor {

    private static final Logger log = LoggerFactory.getLogger(TransactionMonitor.class);

    private final ContextAssembler contextAssembler;
    private final RuleEvaluator ruleEvaluator;
    private final RiskScorer riskScorer;
    private final DecisionEngine decisionEngine;
    private final AssessmentRepository assessmentRepository;
    private final MetricsConfig metricsConfig;

    public TransactionMonitor(ContextAssembler contextAssembler,
                              RuleEvaluator ruleEvaluator,
                              RiskScorer riskScorer,
                              DecisionEngine decisionEngine,
                              AssessmentRepository assessmentRepository,
                              MetricsConfig metricsConfig) {
        this.contextAssembler = contextAssembler;
        this.ruleEvaluator = ruleEvaluator;
        this.riskScorer = riskScorer;
        this.decisionEngine = decisionEngine;
        this.assessmentRepository = assessmentRepository;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "transaction.evaluate", contextualName = "evaluate-transaction")
    public AssessmentResult evaluate(Transaction txn) {
        try {
            validate(txn);

            Optional<AssessmentResult> existing = assessmentRepository.findByTransactionId(txn.getTransactionId());
            if (existing.isPresent()) {
                log.info("Txn {} already assessed as {}, returning stored result",
                        txn.getTransactionId(), existing.get().getDecision());
                return existing.get();
            }

            Context context = contextAssembler.build(txn);
            List<TriggeredRule> triggered = ruleEvaluator.run(txn, context);
            double score = riskScorer.score(triggered);
            AssessmentResult result = decisionEngine.decide(score, triggered, txn, riskScorer.scoringVersion());

            AssessmentResult stored = assessmentRepository.insertOnce(result);

            metricsConfig.recordEvaluation(stored.getDecision().name(), stored.getRiskScore());

            if (stored.getDecision() != Decision.AUTO_APPROVE) {
                log.warn("Suspicious transaction account={}, txn={}: score={}, level={}, decision={}, rules={}",
                        txn.getAccountId(), txn.getTransactionId(), stored.getRiskScore(),
                        stored.getRiskLevel(), stored.getDecision(),
                        stored.getTriggeredRules().stream().map(TriggeredRule::getRuleName).toList());
            } else {
                log.debug("Txn {} auto-approved with score {}", txn.getTransactionId(), stored.getRiskScore());
            }
            return stored;
        } catch (InvalidTransactionException e) {
            metricsConfig.recordEvaluationFailure("invalid_transaction");
            log.warn("Rejected transaction {}: {}", txn == null ? null : txn.getTransactionId(), e.getMessage());
            throw e;
        } catch (LedgerUnavailableException e) {
            metricsConfig.recordEvaluationFailure("ledger_unavailable");
            log.error("Ledger unavailable while evaluating txn {}", txn.getTransactionId(), e);
            throw e;
        } catch (MalformedContextException e) {
            metricsConfig.recordEvaluationFailure("malformed_context");
            log.error("Malformed context for txn {}", txn.getTransactionId(), e);
            throw e;
        } catch (AssessmentPersistenceException e) {
            metricsConfig.recordEvaluationFailure("persistence");
            log.error("Could not persist assessment for txn {}", txn.getTransactionId(), e);
            throw e;
        }
    }

    private void validate(Transaction txn) {
        if (txn == null) {
            throw new InvalidTransactionException("Transaction is required");
        }
        requireText(txn.getTransactionId(), "transactionId");
        requireText(txn.getAccountId(), "accountId");
        requireText(txn.getTransactionType(), "transactionType");
        if (txn.getDirection() == null) {
            throw new InvalidTransactionException("Transaction " + txn.getTransactionId() + " has no direction");
        }
        if (txn.getTimestamp() == null) {
            throw new InvalidTransactionException("Transaction " + txn.getTransactionId() + " has no timestamp");
        }
        if (!(txn.getAmount() >= 0.0) || Double.isInfinite(txn.getAmount())) {
            throw new InvalidTransactionException("Transaction " + txn.getTransactionId()
                    + " has invalid amount " + txn.getAmount());
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidTransactionException("Missing required field: " + field);
        }
    }
}
