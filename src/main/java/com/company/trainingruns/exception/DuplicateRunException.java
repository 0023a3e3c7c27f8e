package com.company.trainingruns.exception;

public class DuplicateRunException extends RuntimeException {
    public DuplicateRunException(String runId, Throwable cause) {
        super("Run already exists: " + runId, cause);
    }
}
