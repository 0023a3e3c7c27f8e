package com.company.trainingruns.exception;

public class ObjectiveNotFoundException extends RuntimeException {
    public ObjectiveNotFoundException(String runId, String objectiveName) {
        super("Objective " + objectiveName + " not found for run " + runId);
    }
}
