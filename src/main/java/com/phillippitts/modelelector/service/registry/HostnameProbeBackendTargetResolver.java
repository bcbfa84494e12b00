package com.phillippitts.modelelector.service.registry;

import com.phillippitts.modelelector.config.properties.ElectorProperties;
import com.phillippitts.modelelector.domain.BackendTarget;
import com.phillippitts.modelelector.exception.BackendConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Picks container or local backend URLs depending on whether a probe hostname resolves.
 *
 * <p>Inside a container network (docker compose, Kubernetes) backend service names resolve
 * through DNS; on a developer machine they do not and the backends listen on localhost ports.
 * The probe runs once per {@link #resolveTargets()} call, which {@link BackendRegistry} invokes
 * once at startup.
 */
public final class HostnameProbeBackendTargetResolver implements BackendTargetResolver {

    private static final Logger LOG = LogManager.getLogger(HostnameProbeBackendTargetResolver.class);

    /**
     * Hostname lookup seam so tests do not depend on the build machine's DNS.
     */
    @FunctionalInterface
    public interface HostLookup {
        void resolve(String host) throws UnknownHostException;
    }

    private final List<ElectorProperties.Backend> backends;
    private final String probeHost;
    private final HostLookup lookup;

    public HostnameProbeBackendTargetResolver(List<ElectorProperties.Backend> backends, String probeHost) {
        this(backends, probeHost, InetAddress::getByName);
    }

    HostnameProbeBackendTargetResolver(List<ElectorProperties.Backend> backends,
                                       String probeHost,
                                       HostLookup lookup) {
        this.backends = List.copyOf(Objects.requireNonNull(backends, "backends"));
        this.probeHost = Objects.requireNonNull(probeHost, "probeHost");
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    @Override
    public List<BackendTarget> resolveTargets() {
        boolean container = isContainerNetwork();
        LOG.info("Backend discovery: probeHost={}, environment={}", probeHost, container ? "container" : "local");

        List<BackendTarget> targets = new ArrayList<>(backends.size());
        for (ElectorProperties.Backend b : backends) {
            String url = container ? b.getContainerUrl() : b.getLocalUrl();
            if (url == null || url.isBlank()) {
                url = b.getBaseUrl();
            }
            if (url == null || url.isBlank()) {
                throw new BackendConfigurationException("backend '" + b.getName() + "' has no "
                        + (container ? "container-url" : "local-url") + " and no base-url");
            }
            targets.add(new BackendTarget(b.getName(), url, b.isPrimary()));
        }
        return targets;
    }

    private boolean isContainerNetwork() {
        try {
            lookup.resolve(probeHost);
            return true;
        } catch (UnknownHostException e) {
            LOG.debug("Probe host {} does not resolve: {}", probeHost, e.getMessage());
            return false;
        }
    }
}
