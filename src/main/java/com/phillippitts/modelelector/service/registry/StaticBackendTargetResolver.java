package com.phillippitts.modelelector.service.registry;

import com.phillippitts.modelelector.config.properties.ElectorProperties;
import com.phillippitts.modelelector.domain.BackendTarget;
import com.phillippitts.modelelector.exception.BackendConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolves backends directly from {@code elector.backends[i].base-url}.
 */
public final class StaticBackendTargetResolver implements BackendTargetResolver {

    private final List<ElectorProperties.Backend> backends;

    public StaticBackendTargetResolver(List<ElectorProperties.Backend> backends) {
        this.backends = List.copyOf(Objects.requireNonNull(backends, "backends"));
    }

    @Override
    public List<BackendTarget> resolveTargets() {
        List<BackendTarget> targets = new ArrayList<>(backends.size());
        for (ElectorProperties.Backend b : backends) {
            if (b.getBaseUrl() == null || b.getBaseUrl().isBlank()) {
                throw new BackendConfigurationException("backend '" + b.getName() + "' has no base-url");
            }
            targets.add(new BackendTarget(b.getName(), b.getBaseUrl(), b.isPrimary()));
        }
        return targets;
    }
}
