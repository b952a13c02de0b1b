package com.bank.fraud.engine;

import com.bank.fraud.context.Context;
import com.bank.fraud.model.Transaction;

/**
 * Pure test of one rule. Absent signals must evaluate to false; a signal of the wrong
 * type surfaces as {@link com.bank.fraud.exception.MalformedContextException} from the
 * {@link Context} accessors.
 */
@FunctionalInterface
public interface RulePredicate {

    boolean test(Transaction txn, Context context);
}
