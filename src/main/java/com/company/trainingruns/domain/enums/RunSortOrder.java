package com.company.trainingruns.domain.enums;

public enum RunSortOrder {
    CREATED_AT_DESC("created_at DESC"),
    CREATED_AT_ASC("created_at ASC"),
    DURATION_DESC("duration_seconds DESC NULLS LAST"),
    DURATION_ASC("duration_seconds ASC NULLS LAST");

    private final String clause;

    RunSortOrder(String clause) {
        this.clause = clause;
    }

    /**
     * ORDER BY clause qualified with the given table alias.
     */
    public String clause(String tableAlias) {
        return tableAlias == null || tableAlias.isEmpty() ? clause : tableAlias + "." + clause;
    }
}
