package com.phillippitts.modelelector.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendTargetTest {

    @Test
    void predictUrlAppendsPath() {
        assertThat(new BackendTarget("model", "http://model:5000", true).predictUrl())
                .isEqualTo("http://model:5000/predict");
    }

    @Test
    void trailingSlashesAreStripped() {
        BackendTarget t = new BackendTarget("model", " http://model:5000// ", true);

        assertThat(t.baseUrl()).isEqualTo("http://model:5000");
        assertThat(t.predictUrl()).isEqualTo("http://model:5000/predict");
    }

    @Test
    void shouldRejectBlankName() {
        assertThatThrownBy(() -> new BackendTarget(" ", "http://x", false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
