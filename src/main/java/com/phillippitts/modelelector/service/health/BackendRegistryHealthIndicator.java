package com.phillippitts.modelelector.service.health;

import com.phillippitts.modelelector.domain.BackendTarget;
import com.phillippitts.modelelector.service.registry.BackendRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports the resolved backend set via /actuator/health.
 *
 * <p>The elector has no persistent connection to its backends, so this indicator reports the
 * configuration it will dispatch to rather than probing backends:
 * <ul>
 *   <li>UP: registry resolved with a primary backend</li>
 * </ul>
 * A registry that fails validation prevents startup, so DOWN is never reported from here.
 */
@Component
public class BackendRegistryHealthIndicator implements HealthIndicator {

    private final BackendRegistry registry;

    public BackendRegistryHealthIndicator(BackendRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Health health() {
        Map<String, String> backends = new LinkedHashMap<>();
        for (BackendTarget t : registry.targets()) {
            backends.put(t.name(), t.baseUrl());
        }
        return Health.up()
                .withDetail("primary", registry.primary().name())
                .withDetail("backends", backends)
                .build();
    }
}
