package com.flagship.custodial_exchange.persistence;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Sequential id counters for orders and lobbies.
 *
 * Unlike a database sequence, the counter row is updated inside the caller's
 * transaction: a rolled-back create gives its id back, so ids stay gap-free.
 * The row lock taken by the update serializes concurrent creates.
 */
@Component
public class RecordCounters {

    public static final String ORDER = "order";
    public static final String LOBBY = "lobby";

    private final JdbcTemplate jdbcTemplate;

    public RecordCounters(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns the counter's current value and advances it by one.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public long next(String counter) {
        Long value = jdbcTemplate.query(
            "UPDATE record_counters SET next_value = next_value + 1 WHERE name = ? RETURNING next_value - 1",
            rs -> rs.next() ? rs.getLong(1) : null,
            counter
        );
        if (value == null) {
            throw new IllegalStateException("Unknown record counter: " + counter);
        }
        return value;
    }
}
