package com.propertyintel.listings.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.util.Locale;

/**
 * Production runs on PostgreSQL (JSONB columns); tests run on H2 in PostgreSQL
 * mode, which has no JSONB, so JSON is stored as plain text there.
 */
@Slf4j
final class DatabaseDialect {

    private final boolean postgres;

    private DatabaseDialect(boolean postgres) {
        this.postgres = postgres;
    }

    static DatabaseDialect detect(JdbcTemplate jdbcTemplate) {
        DataSource dataSource = jdbcTemplate.getDataSource();
        if (dataSource == null) {
            return new DatabaseDialect(false);
        }
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return new DatabaseDialect(false);
            }
            return new DatabaseDialect(productName != null
                    && productName.toLowerCase(Locale.ROOT).contains("postgres"));
        } catch (Exception e) {
            log.warn("Unable to detect database product, assuming PostgreSQL: {}", e.getMessage());
            return new DatabaseDialect(true);
        }
    }

    boolean isPostgres() {
        return postgres;
    }

    /** Column type for JSON documents */
    String jsonType() {
        return postgres ? "JSONB" : "VARCHAR";
    }

    /** Bind placeholder for a JSON document passed as a string */
    String jsonParam() {
        return postgres ? "CAST(? AS JSONB)" : "?";
    }
}
