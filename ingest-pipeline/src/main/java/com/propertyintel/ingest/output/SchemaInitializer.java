package com.propertyintel.ingest.output;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the five pipeline tables if they are missing.
 * Plain SQL that PostgreSQL and H2 both accept.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaInitializer {

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring ingest schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS raw_records
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                source_type     VARCHAR(16)  NOT NULL,
                source_id       VARCHAR(255) NOT NULL,
                payload         TEXT         NOT NULL,
                checksum        VARCHAR(64),
                source_ref      VARCHAR(1024),
                ingested_at     TIMESTAMP    NOT NULL,
                CONSTRAINT uq_raw_source UNIQUE (source_type, source_id)
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_raw_ingested ON raw_records (ingested_at)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS unified_records
            (
                id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                source_type     VARCHAR(16)  NOT NULL,
                source_id       VARCHAR(255) NOT NULL,
                raw_id          BIGINT       NOT NULL,
                title           TEXT,
                description     TEXT,
                content         TEXT,
                author          TEXT,
                category        VARCHAR(255),
                tags            TEXT,
                url             TEXT,
                published_at    TIMESTAMP,
                extra_data      TEXT,
                created_at      TIMESTAMP    NOT NULL,
                updated_at      TIMESTAMP    NOT NULL,
                CONSTRAINT uq_unified_source UNIQUE (source_type, source_id)
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_unified_category ON unified_records (category)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_unified_published ON unified_records (published_at)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS etl_checkpoints
            (
                id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                source_type         VARCHAR(16) NOT NULL,
                last_source_id      VARCHAR(255),
                last_offset         BIGINT      NOT NULL DEFAULT 0,
                last_processed_at   TIMESTAMP,
                checkpoint_metadata TEXT,
                updated_at          TIMESTAMP,
                CONSTRAINT uq_checkpoint_source UNIQUE (source_type)
            )
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS etl_runs
            (
                id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                run_id              VARCHAR(36) NOT NULL,
                source_type         VARCHAR(16) NOT NULL,
                status              VARCHAR(16) NOT NULL,
                started_at          TIMESTAMP   NOT NULL,
                completed_at        TIMESTAMP,
                duration_seconds    DOUBLE PRECISION,
                records_extracted   INTEGER     NOT NULL DEFAULT 0,
                records_transformed INTEGER     NOT NULL DEFAULT 0,
                records_loaded      INTEGER     NOT NULL DEFAULT 0,
                records_skipped     INTEGER     NOT NULL DEFAULT 0,
                records_failed      INTEGER     NOT NULL DEFAULT 0,
                error_message       TEXT,
                error_trace         TEXT,
                checkpoint_data     TEXT,
                run_metadata        TEXT,
                CONSTRAINT uq_run_id UNIQUE (run_id)
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_etl_runs_started ON etl_runs (started_at)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS schema_drift
            (
                id                  BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                source_type         VARCHAR(16)  NOT NULL,
                detected_at         TIMESTAMP    NOT NULL,
                field_name          VARCHAR(255) NOT NULL,
                expected_type       VARCHAR(100),
                actual_type         VARCHAR(100),
                drift_type          VARCHAR(50)  NOT NULL,
                confidence_score    DOUBLE PRECISION,
                sample_value        TEXT,
                resolved            BOOLEAN      NOT NULL DEFAULT FALSE,
                resolved_at         TIMESTAMP
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_schema_drift_detected ON schema_drift (detected_at)");

        log.info("Ingest schema ready.");
    }
}
