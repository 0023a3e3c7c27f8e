package com.company.trainingruns.exception;

public class DuplicateObjectiveException extends RuntimeException {
    public DuplicateObjectiveException(String runId, String objectiveName, Throwable cause) {
        super("Objective " + objectiveName + " already recorded for run " + runId, cause);
    }
}
