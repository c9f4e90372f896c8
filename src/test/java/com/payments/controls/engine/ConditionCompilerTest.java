package com.payments.controls.engine;

import com.payments.controls.domain.CompiledCondition;
import com.payments.controls.domain.Condition;
import com.payments.controls.domain.TransactionRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for ConditionCompiler - compiles conditions into executable lambdas.
 */
class ConditionCompilerTest {

    private static CompiledCondition compile(String key, Object value) {
        return ConditionCompiler.compile(Condition.fromEntry(key, value));
    }

    private static TransactionRecord ach(double amount, Object... extra) {
        return EngineFixtures.record("t1", "ACH", amount, false, extra);
    }

    // ===== Numeric Comparison =====

    @Test
    void testCompileGreaterThan() {
        CompiledCondition compiled = compile("amount_gt", 5000);

        assertThat(compiled.matches(ach(6000))).isTrue();
        assertThat(compiled.matches(ach(5000))).isFalse();
    }

    @Test
    void testCompileGreaterThanOrEqual() {
        CompiledCondition compiled = compile("amount_gte", 5000);

        assertThat(compiled.matches(ach(5000))).isTrue(); // Boundary
        assertThat(compiled.matches(ach(4999.99))).isFalse();
    }

    @Test
    void testCompileLessThanDays() {
        CompiledCondition compiled = compile("account_age_lt_days", 30);

        assertThat(compiled.matches(ach(1, "account_age_days", 10L))).isTrue();
        assertThat(compiled.matches(ach(1, "account_age_days", 30L))).isFalse();
    }

    @Test
    void testCompileLessThanOrEqual() {
        CompiledCondition compiled = compile("wallet_age_lte", 7);

        assertThat(compiled.matches(ach(1, "wallet_age_days", 7.0))).isTrue();
        assertThat(compiled.matches(ach(1, "wallet_age_days", 8.0))).isFalse();
    }

    @Test
    void testNumericCoercesNumericStrings() {
        CompiledCondition compiled = compile("amount_gt", 100);

        assertThat(compiled.matches(ach(1, "amount", "150.5"))).isTrue();
    }

    @Test
    void testNumericNeverMatchesNonNumericOrMissing() {
        CompiledCondition compiled = compile("account_age_lt_days", 30);

        assertThat(compiled.matches(ach(1, "account_age_days", "young"))).isFalse();
        assertThat(compiled.matches(ach(1, "account_age_days", null))).isFalse();
        assertThat(compiled.matches(ach(1))).isFalse();
    }

    // ===== Membership =====

    @Test
    void testMembershipMatchesListElements() {
        CompiledCondition compiled = compile("return_code_in", List.of("R01", "R10"));

        assertThat(compiled.matches(ach(1, "return_code", "R10"))).isTrue();
        assertThat(compiled.matches(ach(1, "return_code", "R02"))).isFalse();
        assertThat(compiled.matches(ach(1, "return_code", null))).isFalse();
    }

    @Test
    void testMembershipComparesNumbersByValue() {
        CompiledCondition compiled = compile("mcc_in", List.of(7995, 5967));

        assertThat(compiled.matches(ach(1, "mcc", 7995L))).isTrue();
        assertThat(compiled.matches(ach(1, "mcc", 5967.0))).isTrue();
        assertThat(compiled.matches(ach(1, "mcc", "7995"))).isFalse();
    }

    @Test
    void testMembershipIsCaseSensitive() {
        CompiledCondition compiled = compile("return_code_in", List.of("R01"));

        assertThat(compiled.matches(ach(1, "return_code", "r01"))).isFalse();
    }

    @Test
    void testEmptyMembershipListNeverMatches() {
        assertThat(compile("return_code_in", List.of()).matches(ach(1, "return_code", "R01"))).isFalse();
    }

    // ===== Boolean Equality =====

    @Test
    void testBooleanEqualsCoercesStrings() {
        CompiledCondition compiled = compile("card_present", false);

        assertThat(compiled.matches(ach(1, "card_present", false))).isTrue();
        assertThat(compiled.matches(ach(1, "card_present", "FALSE"))).isTrue();
        assertThat(compiled.matches(ach(1, "card_present", " false "))).isTrue();
        assertThat(compiled.matches(ach(1, "card_present", true))).isFalse();
    }

    @Test
    void testBooleanEqualsNeverMatchesMissingOrUnparseable() {
        CompiledCondition compiled = compile("is_new_device", true);

        assertThat(compiled.matches(ach(1, "is_new_device", null))).isFalse();
        assertThat(compiled.matches(ach(1, "is_new_device", "yes"))).isFalse();
        assertThat(compiled.matches(ach(1, "is_new_device", 1L))).isFalse();
    }

    // ===== Equality =====

    @Test
    void testStringEqualsIgnoresCase() {
        CompiledCondition compiled = compile("funding_speed", "instant");

        assertThat(compiled.matches(ach(1, "funding_speed", "INSTANT"))).isTrue();
        assertThat(compiled.matches(ach(1, "funding_speed", "standard"))).isFalse();
        assertThat(compiled.matches(ach(1, "funding_speed", null))).isFalse();
    }

    @Test
    void testNumericEqualsComparesByValue() {
        CompiledCondition compiled = compile("mcc", 7995);

        assertThat(compiled.matches(ach(1, "mcc", 7995L))).isTrue();
        assertThat(compiled.matches(ach(1, "mcc", 7995.0))).isTrue();
        assertThat(compiled.matches(ach(1, "mcc", 7996L))).isFalse();
    }

    @Test
    void testNullExpectedNeverMatches() {
        assertThat(compile("return_code", null).matches(ach(1, "return_code", null))).isFalse();
    }

    // ===== Combination =====

    @Test
    void testCompileAllEmptyMatchesEverything() {
        assertThat(ConditionCompiler.compileAll(List.of()).matches(ach(1))).isTrue();
    }

    @Test
    void testCompileAllRequiresEveryCondition() {
        CompiledCondition compiled = ConditionCompiler.compileAll(List.of(
                Condition.fromEntry("funding_speed", "instant"),
                Condition.fromEntry("amount_gt", 5000),
                Condition.fromEntry("account_age_lt_days", 30)));

        assertThat(compiled.matches(ach(6000, "funding_speed", "instant", "account_age_days", 10L))).isTrue();
        assertThat(compiled.matches(ach(6000, "funding_speed", "instant", "account_age_days", 45L))).isFalse();
    }

    @Test
    void testCompiledConditionWorksAsPredicate() {
        CompiledCondition compiled = compile("amount_gt", 100);

        assertThat(List.of(ach(50), ach(150), ach(250)).stream().filter(compiled).count()).isEqualTo(2);
    }
}
