package com.company.trainingruns.tracker;

import com.company.trainingruns.domain.enums.ExternalRunState;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A run record as reported by the external experiment tracker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackerRun {
    private String id;
    private String name;
    private String url;
    private Instant createdAt;
    private String state;
    private Map<String, Object> summary;

    @JsonIgnore
    public ExternalRunState getExternalState() {
        return ExternalRunState.fromString(state);
    }
}
