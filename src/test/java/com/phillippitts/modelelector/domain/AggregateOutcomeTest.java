package com.phillippitts.modelelector.domain;

import com.phillippitts.modelelector.testutil.Backends;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregateOutcomeTest {

    @Test
    void shouldRejectMoreResultsThanDispatched() {
        List<CallResult> results = List.of(
                CallResult.success(Backends.MODEL, "{}", 1),
                CallResult.success(Backends.CANARY, "{}", 2));

        assertThatThrownBy(() -> new AggregateOutcome(results, 1, false, 2))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("only 1");
    }

    @Test
    void reportsMissingResults() {
        AggregateOutcome o = new AggregateOutcome(
                List.of(CallResult.success(Backends.CANARY, "{}", 2)), 2, true, 10);

        assertThat(o.missing()).isEqualTo(1);
        assertThat(o.deadlineExceeded()).isTrue();
    }
}
