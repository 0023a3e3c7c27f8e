package com.company.trainingruns.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class RunDeletedEvent {
    private final String runId;
}
