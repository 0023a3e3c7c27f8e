package com.company.trainingruns.repository;

import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.UUID;

/**
 * In-memory H2 database in PostgreSQL mode, loaded with the production schema.
 */
final class TestDatabase {

    private TestDatabase() {
    }

    static EmbeddedDatabase create() {
        return new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .setName("runs_" + UUID.randomUUID().toString().replace("-", "")
                        + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH")
                .addScript("classpath:schema.sql")
                .build();
    }
}
