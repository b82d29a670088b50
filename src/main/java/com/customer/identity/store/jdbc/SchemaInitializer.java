package com.customer.identity.store.jdbc;

import com.customer.identity.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Applies the bundled {@code db/schema.sql} script. The script is idempotent.
 */
public class SchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    static final String SCHEMA_RESOURCE = "/db/schema.sql";

    private final JdbcTemplate jdbcTemplate;

    public SchemaInitializer(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void createSchema() {
        String script = loadScript();
        DataAccessGuard.run("createSchema", () -> jdbcTemplate.execute(script));
        log.info("schema.applied resource={}", SCHEMA_RESOURCE);
    }

    static String loadScript() {
        try (InputStream in = SchemaInitializer.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new StoreException("Schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Failed to read schema resource " + SCHEMA_RESOURCE, e);
        }
    }
}
