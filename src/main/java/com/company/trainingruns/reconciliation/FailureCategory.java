package com.company.trainingruns.reconciliation;

public enum FailureCategory {
    EXTERNAL_SERVICE,
    MALFORMED_DATA,
    NOT_FOUND,
    CONFLICT,
    UNEXPECTED
}
