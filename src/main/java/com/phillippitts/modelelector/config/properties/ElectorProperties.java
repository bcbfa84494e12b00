package com.phillippitts.modelelector.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed properties for the elector: timeouts, backend list and discovery mode.
 *
 * <p>Properties:
 * <ul>
 *   <li>elector.call-timeout - per-call timeout (default: 5s)</li>
 *   <li>elector.total-timeout - aggregate deadline measured from dispatch start (default: 10s)</li>
 *   <li>elector.discovery.mode - STATIC or HOSTNAME_PROBE (default: STATIC)</li>
 *   <li>elector.discovery.probe-host - hostname probed in HOSTNAME_PROBE mode (default: canary)</li>
 *   <li>elector.backends[i].name / base-url / container-url / local-url / primary</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "elector")
public class ElectorProperties {

    public enum DiscoveryMode { STATIC, HOSTNAME_PROBE }

    @NotNull
    private Duration callTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration totalTimeout = Duration.ofSeconds(10);

    @Valid
    private Discovery discovery = new Discovery();

    @Valid
    private List<Backend> backends = new ArrayList<>();

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public Duration getTotalTimeout() {
        return totalTimeout;
    }

    public void setTotalTimeout(Duration totalTimeout) {
        this.totalTimeout = totalTimeout;
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Discovery discovery) {
        this.discovery = discovery;
    }

    public List<Backend> getBackends() {
        return backends;
    }

    public void setBackends(List<Backend> backends) {
        this.backends = backends;
    }

    /**
     * Backend discovery settings.
     */
    public static class Discovery {
        @NotNull
        private DiscoveryMode mode = DiscoveryMode.STATIC;

        @NotBlank
        private String probeHost = "canary";

        public DiscoveryMode getMode() {
            return mode;
        }

        public void setMode(DiscoveryMode mode) {
            this.mode = mode;
        }

        public String getProbeHost() {
            return probeHost;
        }

        public void setProbeHost(String probeHost) {
            this.probeHost = probeHost;
        }
    }

    /**
     * One configured backend. {@code baseUrl} is used in STATIC mode; {@code containerUrl} and
     * {@code localUrl} are used in HOSTNAME_PROBE mode.
     */
    public static class Backend {
        @NotBlank
        private String name;
        private String baseUrl;
        private String containerUrl;
        private String localUrl;
        private boolean primary;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getContainerUrl() {
            return containerUrl;
        }

        public void setContainerUrl(String containerUrl) {
            this.containerUrl = containerUrl;
        }

        public String getLocalUrl() {
            return localUrl;
        }

        public void setLocalUrl(String localUrl) {
            this.localUrl = localUrl;
        }

        public boolean isPrimary() {
            return primary;
        }

        public void setPrimary(boolean primary) {
            this.primary = primary;
        }
    }
}
