package com.codefarm.shortlink.sequence;

import com.codefarm.shortlink.exception.SequenceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Counter backed by the PostgreSQL sequence {@code short_link_code_seq}, for deployments that
 * would rather not rely on Redis persistence for code generation.
 */
@Component
@ConditionalOnProperty(name = "shortener.sequence.backend", havingValue = "database")
public class DatabaseSequenceSource implements SequenceSource {

    private static final Logger log = LoggerFactory.getLogger(DatabaseSequenceSource.class);

    static final String NEXT_VALUE_SQL = "select nextval('short_link_code_seq')";

    private final JdbcTemplate jdbcTemplate;

    public DatabaseSequenceSource(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long next() {
        Long value;
        try {
            value = jdbcTemplate.queryForObject(NEXT_VALUE_SQL, Long.class);
        } catch (DataAccessException e) {
            log.error("nextval on short_link_code_seq failed: {}", e.getMessage());
            throw new SequenceUnavailableException("Sequence source is unavailable", e);
        }
        if (value == null) {
            throw new SequenceUnavailableException("Sequence query returned no value");
        }
        return value;
    }
}
