package com.phillippitts.modelelector.service.call;

import com.phillippitts.modelelector.domain.BackendTarget;
import com.phillippitts.modelelector.exception.BackendCallException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Objects;

/**
 * {@link BackendClient} backed by Spring's {@link RestTemplate}.
 *
 * <p>Failures are translated into {@link BackendCallException}:
 * <ul>
 *   <li>non-2xx status: reason {@code HTTP <status>}</li>
 *   <li>socket read timeout: flagged as timed out</li>
 *   <li>any other I/O or client failure: reason from the underlying exception</li>
 * </ul>
 */
public class RestTemplateBackendClient implements BackendClient {

    private final RestTemplate restTemplate;

    public RestTemplateBackendClient(RestTemplate restTemplate) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
    }

    @Override
    public String predict(BackendTarget target, String jsonBody) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    target.predictUrl(), new HttpEntity<>(jsonBody, headers), String.class);
            String body = response.getBody();
            return body == null ? "" : body;
        } catch (RestClientResponseException e) {
            throw new BackendCallException(target.name(), "HTTP " + e.getStatusCode().value(), false, e);
        } catch (ResourceAccessException e) {
            boolean timedOut = e.getCause() instanceof SocketTimeoutException;
            throw new BackendCallException(target.name(),
                    (timedOut ? "read timed out: " : "I/O error: ") + e.getMostSpecificCause().getMessage(),
                    timedOut, e);
        } catch (RestClientException e) {
            throw new BackendCallException(target.name(), "client error: " + e.getMessage(), false, e);
        }
    }
}
