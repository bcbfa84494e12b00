package com.phillippitts.modelelector.service.registry;

import com.phillippitts.modelelector.domain.BackendTarget;
import com.phillippitts.modelelector.exception.BackendConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of prediction backends, resolved once and validated at construction.
 *
 * <p>Invariants enforced here:
 * <ul>
 *   <li>at least one backend</li>
 *   <li>backend names are unique</li>
 *   <li>exactly one backend is primary</li>
 *   <li>every base URL is an absolute http(s) URL</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> Read-only after construction; safe to share across requests.
 */
public final class BackendRegistry {

    private static final Logger LOG = LogManager.getLogger(BackendRegistry.class);

    private final List<BackendTarget> targets;
    private final BackendTarget primary;

    /**
     * Resolves and validates the backend set.
     *
     * @param resolver discovery source, invoked exactly once
     * @throws BackendConfigurationException if the resolved set violates an invariant
     */
    public BackendRegistry(BackendTargetResolver resolver) {
        Objects.requireNonNull(resolver, "resolver");
        List<BackendTarget> resolved = resolver.resolveTargets();
        if (resolved == null || resolved.isEmpty()) {
            throw new BackendConfigurationException("no backends configured");
        }
        this.targets = List.copyOf(resolved);
        this.primary = validate(targets);
        LOG.info("Backend registry ready: backends={}, primary={}",
                targets.stream().map(t -> t.name() + "=" + t.baseUrl()).toList(), primary.name());
    }

    /**
     * Returns all backends in dispatch order.
     */
    public List<BackendTarget> targets() {
        return targets;
    }

    /**
     * Returns the single primary backend.
     */
    public BackendTarget primary() {
        return primary;
    }

    /**
     * Returns the non-primary backends in dispatch order.
     */
    public List<BackendTarget> secondaries() {
        return targets.stream().filter(t -> !t.primary()).toList();
    }

    public int size() {
        return targets.size();
    }

    private static BackendTarget validate(List<BackendTarget> targets) {
        Set<String> names = new HashSet<>();
        BackendTarget found = null;
        for (BackendTarget t : targets) {
            if (!names.add(t.name())) {
                throw new BackendConfigurationException("duplicate backend name '" + t.name() + "'");
            }
            validateUrl(t);
            if (t.primary()) {
                if (found != null) {
                    throw new BackendConfigurationException("more than one primary backend ('"
                            + found.name() + "', '" + t.name() + "')");
                }
                found = t;
            }
        }
        if (found == null) {
            throw new BackendConfigurationException("no primary backend among " + names);
        }
        return found;
    }

    private static void validateUrl(BackendTarget t) {
        try {
            URI uri = new URI(t.baseUrl());
            String scheme = uri.getScheme();
            if (!uri.isAbsolute() || uri.getHost() == null
                    || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
                throw new BackendConfigurationException("backend '" + t.name()
                        + "' base URL must be an absolute http(s) URL: " + t.baseUrl());
            }
        } catch (URISyntaxException e) {
            throw new BackendConfigurationException("backend '" + t.name()
                    + "' has a malformed base URL: " + t.baseUrl(), e);
        }
    }
}
