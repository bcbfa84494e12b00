package com.phillippitts.modelelector.config;

import com.phillippitts.modelelector.config.properties.ElectorProperties;
import com.phillippitts.modelelector.service.call.BackendClient;
import com.phillippitts.modelelector.service.call.RestTemplateBackendClient;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Outbound HTTP client for backend prediction calls.
 *
 * <p>Transport connect and read timeouts equal the call timeout, so a hung backend also
 * releases its pool thread shortly after the call is recorded as TIMEOUT.
 */
@Configuration
public class BackendClientConfig {

    @Bean
    public RestTemplate backendRestTemplate(RestTemplateBuilder builder, ElectorProperties props) {
        return builder
                .setConnectTimeout(props.getCallTimeout())
                .setReadTimeout(props.getCallTimeout())
                .build();
    }

    @Bean
    public BackendClient backendClient(RestTemplate backendRestTemplate) {
        return new RestTemplateBackendClient(backendRestTemplate);
    }
}
