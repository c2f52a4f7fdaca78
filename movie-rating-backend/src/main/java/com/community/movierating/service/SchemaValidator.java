package com.community.movierating.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fails startup when the tables the engine writes to are missing.
 */
@Component
public class SchemaValidator implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    static final List<String> REQUIRED_TABLES = List.of("movies", "ratings");

    private final JdbcTemplate jdbcTemplate;

    public SchemaValidator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void run(ApplicationArguments args) {
        for (String table : REQUIRED_TABLES) {
            try {
                jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table + " WHERE 1 = 0", Long.class);
            } catch (DataAccessException e) {
                throw new IllegalStateException("Database schema validation failed: table '" + table
                        + "' is not accessible. Apply db/schema.sql first.", e);
            }
        }
        log.info("Database schema validation passed ({})", REQUIRED_TABLES);
    }
}
