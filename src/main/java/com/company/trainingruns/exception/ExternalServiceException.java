package com.company.trainingruns.exception;

/**
 * Timeout or error response from the experiment tracker or the infrastructure API.
 */
public class ExternalServiceException extends RuntimeException {

    private final String service;

    public ExternalServiceException(String service, String message, Throwable cause) {
        super(service + ": " + message, cause);
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
