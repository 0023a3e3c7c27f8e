package com.company.trainingruns.tracker;

import com.company.trainingruns.domain.enums.ExternalRunState;
import com.company.trainingruns.exception.ExternalServiceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RestExternalTrackerClientTest {

    private static final String BASE = "https://tracker.test";

    private MockRestServiceServer server;
    private RestExternalTrackerClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new RestExternalTrackerClient(restTemplate);
    }

    @Test
    void getById_shouldParseRecord() {
        server.expect(requestTo(BASE + "/api/v1/lab/rl/runs/abc123"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        {
                          "id": "abc123",
                          "name": "expA-v2-ip-10-0-0-1",
                          "url": "https://tracker.test/lab/rl/runs/abc123",
                          "createdAt": "2024-05-01T12:05:00Z",
                          "state": "finished",
                          "summary": {"_runtime": 3600.2, "objectives/A_maximize/raw_mean": 0.8},
                          "tags": ["ignored"]
                        }
                        """, MediaType.APPLICATION_JSON));

        Optional<TrackerRun> run = client.getById("lab", "rl", "abc123");

        assertThat(run).isPresent();
        assertThat(run.get().getCreatedAt()).isEqualTo(Instant.parse("2024-05-01T12:05:00Z"));
        assertThat(run.get().getExternalState()).isEqualTo(ExternalRunState.FINISHED);
        assertThat(run.get().getSummary()).containsEntry("objectives/A_maximize/raw_mean", 0.8);
        server.verify();
    }

    @Test
    void getById_notFound_shouldReturnEmpty() {
        server.expect(requestTo(BASE + "/api/v1/lab/rl/runs/gone"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.getById("lab", "rl", "gone")).isEmpty();
    }

    @Test
    void listAll_serverError_shouldBeExternalServiceFailure() {
        server.expect(requestTo(BASE + "/api/v1/lab/rl/runs?order=-created_at"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.listAll("lab", "rl", "-created_at"))
                .isInstanceOf(ExternalServiceException.class);
    }

    @Test
    void scanHistory_shouldReturnStepsInOrder() {
        server.expect(requestTo(BASE + "/api/v1/lab/rl/runs/abc123/history"))
                .andRespond(withSuccess("""
                        [{"_step": 0, "loss": 1.5}, {"_step": 1, "loss": 0.9}]
                        """, MediaType.APPLICATION_JSON));

        List<Map<String, Object>> history = client.scanHistory("lab", "rl", "abc123");

        assertThat(history).hasSize(2);
        assertThat(history.get(1)).containsEntry("loss", 0.9);
    }
}
