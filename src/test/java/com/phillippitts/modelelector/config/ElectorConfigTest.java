package com.phillippitts.modelelector.config;

import com.phillippitts.modelelector.config.properties.ElectorProperties;
import com.phillippitts.modelelector.service.registry.BackendTargetResolver;
import com.phillippitts.modelelector.service.registry.HostnameProbeBackendTargetResolver;
import com.phillippitts.modelelector.service.registry.StaticBackendTargetResolver;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElectorConfigTest {

    @Test
    void acceptsDefaultTimeouts() {
        assertThatCode(() -> ElectorConfig.validateTimeouts(Duration.ofSeconds(5), Duration.ofSeconds(10)))
                .doesNotThrowAnyException();
    }

    @Test
    void acceptsTotalShorterThanCallTimeout() {
        assertThatCode(() -> ElectorConfig.validateTimeouts(Duration.ofSeconds(5), Duration.ofSeconds(2)))
                .doesNotThrowAnyException();
    }

    @Test
    void rejectsNonPositiveCallTimeout() {
        assertThatThrownBy(() -> ElectorConfig.validateTimeouts(Duration.ZERO, Duration.ofSeconds(10)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("elector.call-timeout");
    }

    @Test
    void rejectsMissingTotalTimeout() {
        assertThatThrownBy(() -> ElectorConfig.validateTimeouts(Duration.ofSeconds(5), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("elector.total-timeout");
    }

    @Test
    void staticDiscoveryIsTheDefault() {
        BackendTargetResolver resolver = new ElectorConfig(new ElectorProperties()).backendTargetResolver();

        assertThat(resolver).isInstanceOf(StaticBackendTargetResolver.class);
    }

    @Test
    void hostnameProbeDiscoveryIsSelectable() {
        ElectorProperties props = new ElectorProperties();
        props.getDiscovery().setMode(ElectorProperties.DiscoveryMode.HOSTNAME_PROBE);

        BackendTargetResolver resolver = new ElectorConfig(props).backendTargetResolver();

        assertThat(resolver).isInstanceOf(HostnameProbeBackendTargetResolver.class);
    }
}
