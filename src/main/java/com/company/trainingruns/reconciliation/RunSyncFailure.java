package com.company.trainingruns.reconciliation;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class RunSyncFailure {
    private final String runId;
    private final FailureCategory category;
    private final String reason;
}
