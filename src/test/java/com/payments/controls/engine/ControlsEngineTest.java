package com.payments.controls.engine;

import com.payments.controls.domain.Control;
import com.payments.controls.domain.ControlAction;
import com.payments.controls.domain.ControlDecision;
import com.payments.controls.domain.ControlHit;
import com.payments.controls.domain.ControlMetric;
import com.payments.controls.domain.Rail;
import com.payments.controls.domain.TransactionBatch;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end engine behavior over small hand-built batches.
 */
class ControlsEngineTest {

    private final ControlsEngine engine = EngineFixtures.engine();

    private static Control achReviewControl() {
        Map<String, Object> conditions = new LinkedHashMap<>();
        conditions.put("funding_speed", "instant");
        conditions.put("amount_gt", 5000);
        conditions.put("account_age_lt_days", 30);
        return new Control("ACH_INSTANT_NEW_ACCOUNT", Rail.ACH, "REVIEW", conditions);
    }

    private static Control achReturnCodeControl() {
        return new Control("ACH_RETURN_CODE", Rail.ACH, "BLOCK", Map.of("return_code_in", List.of("R01", "R10")));
    }

    private static TransactionBatch achBatch() {
        return EngineFixtures.batch(EngineFixtures.row("ach_1", "ACH", 6000, true,
                "funding_speed", "instant", "account_age_days", 10L, "return_code", null));
    }

    @Test
    void singleMatchingControlProducesOneHitAndReview() {
        EvaluationResult result = engine.evaluate(achBatch(), List.of(achReviewControl()));

        assertThat(result.hits()).hasSize(1);
        assertThat(result.decisions()).hasSize(1);
        assertThat(result.decisions().get(0).finalAction()).isEqualTo(ControlAction.REVIEW);
    }

    @Test
    void membershipOnNullValueAddsNoHit() {
        EvaluationResult result = engine.evaluate(achBatch(), List.of(achReviewControl(), achReturnCodeControl()));

        assertThat(result.hits()).extracting(ControlHit::controlId).containsExactly("ACH_INSTANT_NEW_ACCOUNT");
        assertThat(result.decisions().get(0).finalAction()).isEqualTo(ControlAction.REVIEW);
    }

    @Test
    void reviewAndBlockResolveToBlock() {
        TransactionBatch batch = EngineFixtures.batch(EngineFixtures.row("ach_1", "ACH", 6000, true,
                "funding_speed", "instant", "account_age_days", 10L, "return_code", "R10"));

        EvaluationResult result = engine.evaluate(batch, List.of(achReviewControl(), achReturnCodeControl()));

        ControlDecision decision = result.decisions().get(0);
        assertThat(decision.finalAction()).isEqualTo(ControlAction.BLOCK);
        assertThat(decision.triggeredActionsDisplay()).isEqualTo("BLOCK, REVIEW");
        assertThat(decision.triggeredControlsDisplay()).isEqualTo("ACH_INSTANT_NEW_ACCOUNT, ACH_RETURN_CODE");
    }

    @Test
    void controlWithoutRailPopulationIsAbsentFromMetrics() {
        Control crypto = new Control("CRYPTO_ANY", Rail.CRYPTO, "BLOCK", Map.of());

        EvaluationResult result = engine.evaluate(achBatch(), List.of(achReviewControl(), crypto));

        assertThat(result.metrics()).extracting(ControlMetric::controlId).containsExactly("ACH_INSTANT_NEW_ACCOUNT");
    }

    @Test
    void cardControlNeverHitsOtherRails() {
        TransactionBatch batch = EngineFixtures.batch(
                EngineFixtures.row("ach_1", "ACH", 10, false),
                EngineFixtures.row("crypto_1", "CRYPTO", 10, false),
                EngineFixtures.row("card_1", "CARD", 10, false));

        EvaluationResult result = engine.evaluate(batch,
                List.of(new Control("CARD_ALL", Rail.CARD, "BLOCK", Map.of())));

        assertThat(result.hits()).extracting(ControlHit::transactionId).containsExactly("card_1");
        assertThat(result.decisions()).extracting(ControlDecision::finalAction)
                .containsExactly(ControlAction.ALLOW, ControlAction.ALLOW, ControlAction.BLOCK);
    }

    @Test
    void duplicateControlIdsApplyIndependentlyAndMergeInMetrics() {
        TransactionBatch batch = EngineFixtures.batch(
                EngineFixtures.row("t1", "CARD", 1000, true),
                EngineFixtures.row("t2", "CARD", 50, false));
        Control big = new Control("CARD_DUP", Rail.CARD, "BLOCK", Map.of("amount_gt", 500));
        Control small = new Control("CARD_DUP", Rail.CARD, "REVIEW", Map.of("amount_lt", 100));

        EvaluationResult result = engine.evaluate(batch, List.of(big, small));

        assertThat(result.hits()).hasSize(2);
        assertThat(result.decisions()).extracting(ControlDecision::finalAction)
                .containsExactly(ControlAction.BLOCK, ControlAction.REVIEW);
        assertThat(result.metrics()).containsExactly(new ControlMetric("CARD_DUP", 2, 1.0, 0.5));
    }

    @Test
    void evaluatingTwiceYieldsEqualResults() {
        TransactionBatch batch = EngineFixtures.batch(
                EngineFixtures.row("t1", "ACH", 6000, true, "funding_speed", "instant", "account_age_days", 3L),
                EngineFixtures.row("t2", "ACH", 10, false, "funding_speed", "standard", "account_age_days", 300L));
        List<Control> controls = List.of(achReviewControl(), achReturnCodeControl());

        assertThat(engine.evaluate(batch, controls)).isEqualTo(engine.evaluate(batch, controls));
    }

    @Test
    void parallelEngineMatchesSequentialEngine() {
        TransactionBatch batch = EngineFixtures.batch(
                EngineFixtures.row("t1", "ACH", 6000, true, "funding_speed", "instant", "account_age_days", 3L),
                EngineFixtures.row("t2", "CARD", 900, false));
        List<Control> controls = List.of(achReviewControl(), achReturnCodeControl(),
                new Control("CARD_ALL", Rail.CARD, "REVIEW", Map.of()));

        assertThat(EngineFixtures.engine(3).evaluate(batch, controls)).isEqualTo(engine.evaluate(batch, controls));
    }

    @Test
    void emptyBatchProducesEmptyTables() {
        TransactionBatch batch = EngineFixtures.batch(
                List.copyOf(com.payments.controls.domain.TransactionRecord.REQUIRED_FIELDS), List.of());

        EvaluationResult result = engine.evaluate(batch, List.of(achReviewControl()));

        assertThat(result.decisions()).isEmpty();
        assertThat(result.hits()).isEmpty();
        assertThat(result.metrics()).isEmpty();
        assertThat(result.summary().transactions()).isZero();
    }

    @Test
    void exactlyOneDecisionPerTransaction() {
        TransactionBatch batch = EngineFixtures.batch(
                EngineFixtures.row("t1", "CARD", 1000, false),
                EngineFixtures.row("t2", "CARD", 2000, false),
                EngineFixtures.row("t3", "ACH", 3000, false));
        List<Control> controls = List.of(
                new Control("A", Rail.CARD, "REVIEW", Map.of()),
                new Control("B", Rail.CARD, "BLOCK", Map.of("amount_gt", 1500)),
                new Control("C", Rail.ACH, "REVIEW", Map.of()));

        EvaluationResult result = engine.evaluate(batch, controls);

        assertThat(result.decisions()).extracting(ControlDecision::transactionId)
                .containsExactly("t1", "t2", "t3");
        assertThat(result.summary().count(ControlAction.BLOCK)).isEqualTo(1);
        assertThat(result.summary().count(ControlAction.REVIEW)).isEqualTo(2);
    }
}
