package com.company.trainingruns.event;

import com.company.trainingruns.domain.enums.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A status write was applied. {@code exitReason} is null while the run is live.
 */
@Getter
@AllArgsConstructor
public class RunStatusChangedEvent {
    private final String runId;
    private final RunStatus status;
    private final String exitReason;
}
