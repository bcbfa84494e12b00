package com.phillippitts.modelelector.domain;

import com.phillippitts.modelelector.testutil.Backends;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionTest {

    @Test
    void selectedKeepsPayloadAndSource() {
        Decision d = Decision.selected(CallResult.success(Backends.CANARY, "{}", 3));

        assertThat(d.isSelected()).isTrue();
        assertThat(d.payload()).isEqualTo("{}");
        assertThat(d.source()).isEqualTo(Backends.CANARY);
    }

    @Test
    void cannotSelectAFailedCall() {
        assertThatThrownBy(() -> Decision.selected(CallResult.timeout(Backends.MODEL, 5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("TIMEOUT");
    }

    @Test
    void noBackendAvailableCarriesNothing() {
        Decision d = Decision.noBackendAvailable();

        assertThat(d.isSelected()).isFalse();
        assertThat(d.kind()).isEqualTo(Decision.Kind.NO_BACKEND_AVAILABLE);
        assertThat(d.payload()).isNull();
        assertThat(d.source()).isNull();
    }

    @Test
    void noBackendAvailableRejectsPayload() {
        assertThatThrownBy(() -> new Decision(Decision.Kind.NO_BACKEND_AVAILABLE, "{}", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
