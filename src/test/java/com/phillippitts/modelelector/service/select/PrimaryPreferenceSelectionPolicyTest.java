package com.phillippitts.modelelector.service.select;

import com.phillippitts.modelelector.domain.BackendTarget;
import com.phillippitts.modelelector.domain.CallResult;
import com.phillippitts.modelelector.domain.Decision;
import com.phillippitts.modelelector.testutil.Backends;
import org.junit.jupiter.api.Test;

import static com.phillippitts.modelelector.testutil.CallResults.outcome;
import static org.assertj.core.api.Assertions.assertThat;

class PrimaryPreferenceSelectionPolicyTest {

    private final SelectionPolicy policy = new PrimaryPreferenceSelectionPolicy();

    private static CallResult ok(BackendTarget t, String payload) {
        return CallResult.success(t, payload, 10);
    }

    @Test
    void primarySuccessWinsEvenWhenSecondaryFinishedFirst() {
        Decision d = policy.select(outcome(2,
                ok(Backends.CANARY, "{\"from\":\"canary\"}"),
                ok(Backends.MODEL, "{\"from\":\"model\"}")));

        assertThat(d.isSelected()).isTrue();
        assertThat(d.source()).isEqualTo(Backends.MODEL);
        assertThat(d.payload()).isEqualTo("{\"from\":\"model\"}");
    }

    @Test
    void firstSuccessfulSecondaryWinsWhenPrimaryFailed() {
        Decision d = policy.select(outcome(3,
                CallResult.error(Backends.MODEL, "HTTP 500", 5),
                ok(Backends.SHADOW, "{\"from\":\"shadow\"}"),
                ok(Backends.CANARY, "{\"from\":\"canary\"}")));

        assertThat(d.source()).isEqualTo(Backends.SHADOW);
    }

    @Test
    void secondaryWinsWhenPrimaryTimedOut() {
        Decision d = policy.select(outcome(2,
                ok(Backends.CANARY, "{\"from\":\"canary\"}"),
                CallResult.timeout(Backends.MODEL, 5000)));

        assertThat(d.source()).isEqualTo(Backends.CANARY);
    }

    @Test
    void secondaryWinsWhenPrimaryWasNeverObserved() {
        Decision d = policy.select(outcome(2, ok(Backends.CANARY, "{\"from\":\"canary\"}")));

        assertThat(d.source()).isEqualTo(Backends.CANARY);
    }

    @Test
    void failedSecondariesAreSkipped() {
        Decision d = policy.select(outcome(3,
                CallResult.error(Backends.CANARY, "HTTP 502", 3),
                CallResult.timeout(Backends.MODEL, 5000),
                ok(Backends.SHADOW, "[1,2]")));

        assertThat(d.source()).isEqualTo(Backends.SHADOW);
        assertThat(d.payload()).isEqualTo("[1,2]");
    }

    @Test
    void noSuccessMeansNoBackendAvailable() {
        Decision d = policy.select(outcome(2,
                CallResult.error(Backends.CANARY, "HTTP 500", 3),
                CallResult.timeout(Backends.MODEL, 5000)));

        assertThat(d.kind()).isEqualTo(Decision.Kind.NO_BACKEND_AVAILABLE);
        assertThat(d.payload()).isNull();
    }

    @Test
    void nothingCollectedMeansNoBackendAvailable() {
        assertThat(policy.select(outcome(2)).isSelected()).isFalse();
    }

    @Test
    void identicalInputsGiveIdenticalDecisions() {
        CallResult a = ok(Backends.CANARY, "{\"a\":1}");
        CallResult b = ok(Backends.SHADOW, "{\"b\":1}");

        Decision first = policy.select(outcome(3, a, b));
        Decision second = policy.select(outcome(3, a, b));

        assertThat(first).isEqualTo(second);
    }
}
