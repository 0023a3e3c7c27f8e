package com.company.trainingruns.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ObjectiveMetricsUpdatedEvent {
    private final String runId;
    private final int objectivesUpdated;
}
