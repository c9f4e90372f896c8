package com.payments.controls.domain;

import java.util.function.Predicate;

/**
 * A condition compiled into an executable predicate over a single transaction row.
 * <p>
 * Controls are compiled once at load time; evaluation only runs the lambdas.
 * A compiled condition always yields a concrete boolean: missing or un-coercible
 * values evaluate to {@code false}.
 *
 * @see com.payments.controls.engine.ConditionCompiler
 */
@FunctionalInterface
public interface CompiledCondition extends Predicate<TransactionRecord> {

    /**
     * Evaluates this condition against the given row.
     *
     * @param record the transaction row
     * @return true if the condition holds
     */
    boolean matches(TransactionRecord record);

    @Override
    default boolean test(TransactionRecord record) {
        return matches(record);
    }
}
