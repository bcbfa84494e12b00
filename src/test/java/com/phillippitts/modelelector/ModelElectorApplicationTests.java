package com.phillippitts.modelelector;

import com.phillippitts.modelelector.config.IntegrationTestConfiguration;
import com.phillippitts.modelelector.service.election.ElectionService;
import com.phillippitts.modelelector.service.registry.BackendRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import static org.assertj.core.api.Assertions.assertThat;

@Import(IntegrationTestConfiguration.class)
@SpringBootTest
class ModelElectorApplicationTests {

    @Autowired
    private BackendRegistry registry;

    @Autowired
    private ElectionService electionService;

    @Test
    void contextLoads() {
        assertThat(electionService).isNotNull();
        assertThat(registry.primary().name()).isEqualTo("model");
        assertThat(registry.targets()).extracting(t -> t.name()).containsExactly("canary", "model");
    }
}
