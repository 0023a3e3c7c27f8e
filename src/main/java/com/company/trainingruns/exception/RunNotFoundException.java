package com.company.trainingruns.exception;

public class RunNotFoundException extends RuntimeException {
    public RunNotFoundException(String runId) {
        super("Run not found: " + runId);
    }
}
