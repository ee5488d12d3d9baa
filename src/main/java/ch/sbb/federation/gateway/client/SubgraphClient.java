package ch.sbb.federation.gateway.client;

import ch.sbb.federation.gateway.error.FetchException;
import ch.sbb.federation.gateway.model.ProbeResult;
import ch.sbb.federation.gateway.model.SubgraphSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for communicating with subgraphs.
 *
 * <p>Sends GraphQL documents, fetches subgraph SDL and probes subgraph health.
 * Query fetches are retried on I/O failure; mutations are sent exactly once.</p>
 */
@Service
public class SubgraphClient {

    private static final Logger log = LoggerFactory.getLogger(SubgraphClient.class);

    static final String SDL_QUERY = "{ _service { sdl } }";
    static final String PROBE_QUERY = "{ __typename }";

    private final RestTemplate restTemplate;
    private final RestTemplate healthRestTemplate;
    private final RetryTemplate retryTemplate;

    public SubgraphClient(RestTemplate restTemplate,
                          @Qualifier("healthRestTemplate") RestTemplate healthRestTemplate,
                          RetryTemplate retryTemplate) {
        this.restTemplate = restTemplate;
        this.healthRestTemplate = healthRestTemplate;
        this.retryTemplate = retryTemplate;
    }

    /**
     * Send a GraphQL document to a subgraph.
     *
     * @param subgraph the subgraph name, used for error tagging
     * @param url the subgraph endpoint
     * @param document the GraphQL document
     * @param variables variable values
     * @param retryable whether an I/O failure may be retried (queries only)
     * @return the subgraph response
     * @throws FetchException if the subgraph cannot be reached or answers with a non-GraphQL body
     */
    public SubgraphResponse execute(String subgraph, String url, String document,
                                    Map<String, Object> variables, boolean retryable) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("query", document);
        request.put("variables", variables != null ? variables : Map.of());

        log.debug("Sending fetch to subgraph {} at {}", subgraph, url);

        try {
            Map<String, Object> body = retryable
                ? retryTemplate.execute(context -> post(url, request))
                : post(url, request);
            return toResponse(subgraph, body);
        } catch (RestClientException e) {
            log.warn("Fetch to subgraph {} failed: {}", subgraph, e.getMessage());
            throw new FetchException(subgraph, "Subgraph '" + subgraph + "' request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Fetch a subgraph's SDL through {@code _service { sdl }}.
     *
     * @param subgraph the subgraph name
     * @param url the subgraph endpoint
     * @return the SDL text
     */
    public String fetchSdl(String subgraph, String url) {
        SubgraphResponse response = execute(subgraph, url, SDL_QUERY, Map.of(), true);
        if (response.data() != null && response.data().get("_service") instanceof Map<?, ?> service
            && service.get("sdl") instanceof String sdl) {
            return sdl;
        }
        String reason = response.hasErrors() ? String.valueOf(response.errors().get(0).get("message")) : "no SDL returned";
        throw new FetchException(subgraph, "Subgraph '" + subgraph + "' did not return its SDL: " + reason,
            List.of("_service", "sdl"));
    }

    /**
     * Probe a subgraph once with the bounded health timeout.
     *
     * <p>Uses a GET against the health URL when one is configured, otherwise a
     * {@code { __typename }} query against the GraphQL endpoint.</p>
     *
     * @param subgraph the subgraph
     * @return the probe outcome, never throws
     */
    @SuppressWarnings("rawtypes")
    public ProbeResult probe(SubgraphSchema subgraph) {
        try {
            Instant start = Instant.now();
            ResponseEntity<?> response;
            if (subgraph.healthUrl() != null && !subgraph.healthUrl().isBlank()) {
                log.debug("Checking health of subgraph {} at {}", subgraph.name(), subgraph.healthUrl());
                response = healthRestTemplate.getForEntity(subgraph.healthUrl(), String.class);
            } else {
                log.debug("Probing subgraph {} at {}", subgraph.name(), subgraph.url());
                response = healthRestTemplate.postForEntity(subgraph.url(), Map.of("query", PROBE_QUERY), Map.class);
            }
            Duration latency = Duration.between(start, Instant.now());

            if (!response.getStatusCode().is2xxSuccessful()) {
                return ProbeResult.failure("HTTP " + response.getStatusCode().value());
            }
            return ProbeResult.success(latency);
        } catch (RestClientException e) {
            log.debug("Health probe failed for subgraph {}: {}", subgraph.name(), e.getMessage());
            return ProbeResult.failure(e.getMessage());
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Map<String, Object> post(String url, Map<String, Object> request) {
        ResponseEntity<Map> response = restTemplate.postForEntity(url, request, Map.class);
        return response.getBody();
    }

    @SuppressWarnings("unchecked")
    private SubgraphResponse toResponse(String subgraph, Map<String, Object> body) {
        if (body == null) {
            throw new FetchException(subgraph, "Subgraph '" + subgraph + "' returned an empty body", List.of());
        }
        Object data = body.get("data");
        Object errors = body.get("errors");
        if (data != null && !(data instanceof Map)) {
            throw new FetchException(subgraph, "Subgraph '" + subgraph + "' returned malformed data", List.of());
        }
        return new SubgraphResponse((Map<String, Object>) data,
            errors instanceof List<?> list ? (List<Map<String, Object>>) list : List.of());
    }
}
