package com.propertyintel.listings.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.listings.model.Listing;
import com.propertyintel.listings.model.ListingDetails;
import com.propertyintel.listings.model.ListingStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

@Repository
@Slf4j
public class JdbcListingStore implements ListingStore {

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};
    private static final TypeReference<TreeMap<String, Long>> PRICES = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final DatabaseDialect dialect;

    public JdbcListingStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.dialect = DatabaseDialect.detect(jdbcTemplate);
    }

    public void ensureSchema() {
        log.info("Ensuring listing schema exists (postgres={})...", dialect.isPostgres());

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS listings
            (
                property_code           VARCHAR(20) PRIMARY KEY,
                first_seen_at           TIMESTAMP NOT NULL,
                last_seen_at            TIMESTAMP NOT NULL,
                publication_date        DATE,
                is_active               BOOLEAN NOT NULL DEFAULT TRUE,
                sold_or_withdrawn_at    DATE,
                republished             BOOLEAN NOT NULL DEFAULT FALSE,
                republished_at          TIMESTAMP
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS listing_details
            (
                id                  UUID PRIMARY KEY,
                property_code       VARCHAR(20) NOT NULL UNIQUE
                                    REFERENCES listings(property_code) ON DELETE CASCADE,
                price               BIGINT NOT NULL,
                previous_prices     %s,
                all_fields_json     %s NOT NULL
            )
        """.formatted(dialect.jsonType(), dialect.jsonType()));

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_listings_is_active ON listings(is_active)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_listings_last_seen_at ON listings(last_seen_at)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_listing_details_price ON listing_details(price)");

        log.info("Listing schema ready.");
    }

    @Override
    public boolean isReachable() {
        try {
            Integer value = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return value != null && value == 1;
        } catch (DataAccessException e) {
            log.error("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<Listing> findListing(String propertyCode) {
        List<Listing> rows = jdbcTemplate.query("""
            SELECT property_code, first_seen_at, last_seen_at, publication_date, is_active,
                   sold_or_withdrawn_at, republished, republished_at
            FROM listings
            WHERE property_code = ?
            """, listingMapper(), propertyCode);
        return rows.stream().findFirst();
    }

    @Override
    public Optional<ListingDetails> findDetails(String propertyCode) {
        List<ListingDetails> rows = jdbcTemplate.query("""
            SELECT property_code, price, previous_prices, all_fields_json
            FROM listing_details
            WHERE property_code = ?
            """, detailsMapper(), propertyCode);
        return rows.stream().findFirst();
    }

    @Override
    public void insertListing(Listing listing) {
        jdbcTemplate.update("""
            INSERT INTO listings
            (property_code, first_seen_at, last_seen_at, publication_date, is_active,
             sold_or_withdrawn_at, republished, republished_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """,
                listing.getPropertyCode(),
                timestamp(listing.getFirstSeenAt()),
                timestamp(listing.getLastSeenAt()),
                date(listing.getPublicationDate()),
                listing.isActive(),
                date(listing.getSoldOrWithdrawnAt()),
                listing.isRepublished(),
                timestamp(listing.getRepublishedAt()));
    }

    @Override
    public void insertDetails(ListingDetails details) {
        jdbcTemplate.update("""
            INSERT INTO listing_details (id, property_code, price, previous_prices, all_fields_json)
            VALUES (?, ?, ?, %s, %s)
            """.formatted(dialect.jsonParam(), dialect.jsonParam()),
                UUID.randomUUID(),
                details.getPropertyCode(),
                details.getPrice(),
                toJson(details.getPreviousPrices()),
                toJson(details.getAllFields()));
    }

    @Override
    public void updateListing(Listing listing) {
        jdbcTemplate.update("""
            UPDATE listings
            SET last_seen_at = ?, publication_date = ?, is_active = ?,
                sold_or_withdrawn_at = ?, republished = ?, republished_at = ?
            WHERE property_code = ?
            """,
                timestamp(listing.getLastSeenAt()),
                date(listing.getPublicationDate()),
                listing.isActive(),
                date(listing.getSoldOrWithdrawnAt()),
                listing.isRepublished(),
                timestamp(listing.getRepublishedAt()),
                listing.getPropertyCode());
    }

    @Override
    public void updateDetails(ListingDetails details) {
        jdbcTemplate.update("""
            UPDATE listing_details
            SET price = ?, previous_prices = %s, all_fields_json = %s
            WHERE property_code = ?
            """.formatted(dialect.jsonParam(), dialect.jsonParam()),
                details.getPrice(),
                toJson(details.getPreviousPrices()),
                toJson(details.getAllFields()),
                details.getPropertyCode());
    }

    @Override
    public int markInactiveNotSeenSince(Instant watermark, LocalDate deactivatedOn) {
        int count = jdbcTemplate.update("""
            UPDATE listings
            SET is_active = FALSE, sold_or_withdrawn_at = ?
            WHERE is_active = TRUE
              AND last_seen_at < ?
            """, date(deactivatedOn), timestamp(watermark));

        log.info("Marked {} listings inactive (not seen since {})", count, watermark);
        return count;
    }

    @Override
    public ListingStatistics statistics() {
        return jdbcTemplate.queryForObject("""
            SELECT
                COUNT(*) AS total,
                COALESCE(SUM(CASE WHEN is_active THEN 1 ELSE 0 END), 0) AS active,
                COALESCE(SUM(CASE WHEN is_active THEN 0 ELSE 1 END), 0) AS inactive,
                COALESCE(SUM(CASE WHEN republished THEN 1 ELSE 0 END), 0) AS republished
            FROM listings
            """, (rs, rowNum) -> new ListingStatistics(
                rs.getLong("total"),
                rs.getLong("active"),
                rs.getLong("inactive"),
                rs.getLong("republished")));
    }

    // ── Row mapping ──────────────────────────────────────────────────────────

    private RowMapper<Listing> listingMapper() {
        return (rs, rowNum) -> Listing.builder()
                .propertyCode(rs.getString("property_code"))
                .firstSeenAt(instant(rs, "first_seen_at"))
                .lastSeenAt(instant(rs, "last_seen_at"))
                .publicationDate(localDate(rs, "publication_date"))
                .active(rs.getBoolean("is_active"))
                .soldOrWithdrawnAt(localDate(rs, "sold_or_withdrawn_at"))
                .republished(rs.getBoolean("republished"))
                .republishedAt(instant(rs, "republished_at"))
                .build();
    }

    private RowMapper<ListingDetails> detailsMapper() {
        return (rs, rowNum) -> {
            String previous = rs.getString("previous_prices");
            return ListingDetails.builder()
                    .propertyCode(rs.getString("property_code"))
                    .price(rs.getLong("price"))
                    .previousPrices(previous == null ? new TreeMap<>() : fromJson(previous, PRICES))
                    .allFields(fromJson(rs.getString("all_fields_json"), FIELDS))
                    .build();
        };
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise listing JSON column", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not parse listing JSON column", e);
        }
    }

    /** TIMESTAMP columns hold UTC wall-clock time, whatever the JVM default zone is */
    private static LocalDateTime timestamp(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Date date(LocalDate date) {
        return date == null ? null : Date.valueOf(date);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        LocalDateTime utc = rs.getObject(column, LocalDateTime.class);
        return utc == null ? null : utc.toInstant(ZoneOffset.UTC);
    }

    private static LocalDate localDate(ResultSet rs, String column) throws SQLException {
        Date date = rs.getDate(column);
        return date == null ? null : date.toLocalDate();
    }
}
