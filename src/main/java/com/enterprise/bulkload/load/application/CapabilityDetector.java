package com.enterprise.bulkload.load.application;

import com.enterprise.bulkload.sql.core.EngineVersion;
import com.enterprise.bulkload.sql.core.SqlDialect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.Objects;

/**
 * Decides whether the connected engine accepts {@code INSERT ... RETURNING}.
 * Anything that goes wrong while asking counts as "no".
 */
public class CapabilityDetector {

    private static final Logger log = LoggerFactory.getLogger(CapabilityDetector.class);

    private final SqlDialect dialect;

    public CapabilityDetector(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
    }

    public boolean detect(JdbcTemplate jdbc) {
        try {
            String reported = jdbc.queryForObject(dialect.versionQuery(), String.class);
            boolean supported = supports(reported);
            log.debug("Engine version {} -> RETURNING {}", reported, supported ? "supported" : "unsupported");
            return supported;
        } catch (RuntimeException e) {
            log.warn("Engine version query failed, assuming no RETURNING support: {}", e.getMessage());
            return false;
        }
    }

    public boolean supports(String reportedVersion) {
        return EngineVersion.parse(reportedVersion).isAtLeast(dialect.minimumReturningVersion());
    }
}
