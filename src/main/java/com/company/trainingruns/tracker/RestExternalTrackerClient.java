package com.company.trainingruns.tracker;

import com.company.trainingruns.exception.ExternalServiceException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tracker client over its JSON HTTP API. Connect and read timeouts are set on the
 * injected {@link RestTemplate}; calls are never retried here.
 */
@Component
@Slf4j
public class RestExternalTrackerClient implements ExternalTrackerClient {

    static final String SERVICE = "tracker";

    private static final String RUNS_PATH = "/api/v1/{entity}/{project}/runs";
    private static final ParameterizedTypeReference<List<Map<String, Object>>> HISTORY_TYPE =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;

    public RestExternalTrackerClient(@Qualifier("trackerRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    @CircuitBreaker(name = "trackerApi", fallbackMethod = "getByIdUnavailable")
    public Optional<TrackerRun> getById(String entity, String project, String id) {
        try {
            TrackerRun run = restTemplate.getForObject(RUNS_PATH + "/{id}", TrackerRun.class, entity, project, id);
            return Optional.ofNullable(run);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Tracker has no run {}", id);
            return Optional.empty();
        } catch (RestClientException e) {
            throw new ExternalServiceException(SERVICE, "lookup of run " + id + " failed", e);
        }
    }

    @Override
    @CircuitBreaker(name = "trackerApi", fallbackMethod = "listUnavailable")
    public List<TrackerRun> searchByName(String entity, String project, String displayName) {
        try {
            TrackerRun[] runs = restTemplate.getForObject(RUNS_PATH + "?displayName={name}",
                    TrackerRun[].class, entity, project, displayName);
            return runs != null ? Arrays.asList(runs) : Collections.emptyList();
        } catch (RestClientException e) {
            throw new ExternalServiceException(SERVICE, "search for name " + displayName + " failed", e);
        }
    }

    @Override
    @CircuitBreaker(name = "trackerApi", fallbackMethod = "listUnavailable")
    public List<TrackerRun> listAll(String entity, String project, String order) {
        try {
            TrackerRun[] runs = restTemplate.getForObject(RUNS_PATH + "?order={order}",
                    TrackerRun[].class, entity, project, order);
            return runs != null ? Arrays.asList(runs) : Collections.emptyList();
        } catch (RestClientException e) {
            throw new ExternalServiceException(SERVICE, "listing runs failed", e);
        }
    }

    @Override
    @CircuitBreaker(name = "trackerApi", fallbackMethod = "historyUnavailable")
    public List<Map<String, Object>> scanHistory(String entity, String project, String id) {
        try {
            List<Map<String, Object>> rows = restTemplate.exchange(RUNS_PATH + "/{id}/history",
                    HttpMethod.GET, null, HISTORY_TYPE, entity, project, id).getBody();
            return rows != null ? rows : Collections.emptyList();
        } catch (RestClientException e) {
            throw new ExternalServiceException(SERVICE, "history scan of run " + id + " failed", e);
        }
    }

    private Optional<TrackerRun> getByIdUnavailable(String entity, String project, String id,
                                                    CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private List<TrackerRun> listUnavailable(String entity, String project, String filter,
                                             CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private List<Map<String, Object>> historyUnavailable(String entity, String project, String id,
                                                         CallNotPermittedException e) {
        throw circuitOpen(e);
    }

    private ExternalServiceException circuitOpen(CallNotPermittedException e) {
        log.warn("Tracker circuit breaker open, skipping call");
        return new ExternalServiceException(SERVICE, "circuit breaker open", e);
    }
}
