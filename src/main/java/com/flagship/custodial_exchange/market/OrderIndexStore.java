package com.flagship.custodial_exchange.market;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Append-only owner/buyer indices over order ids.
 *
 * Each entry has a dense per-address position starting at 0; pagination
 * reads ranges of positions. Appends to one (kind, address) index are
 * serialized by a transaction-scoped advisory lock taken before the slot is
 * computed; the lock is released on commit or rollback.
 */
@Component
public class OrderIndexStore {

    private final JdbcTemplate jdbcTemplate;

    public OrderIndexStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Must run inside the caller's transaction so the index lock is held
     * until it commits.
     */
    public void append(OrderIndexKind kind, String address, long orderId) {
        jdbcTemplate.queryForList("SELECT pg_advisory_xact_lock(hashtext(?))", kind.name() + ":" + address);
        jdbcTemplate.update(
            "INSERT INTO order_index_entries (index_kind, address, position, order_id) " +
            "SELECT ?, ?, COUNT(*), ? FROM order_index_entries WHERE index_kind = ? AND address = ?",
            kind.name(), address, orderId, kind.name(), address
        );
    }

    public long count(OrderIndexKind kind, String address) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM order_index_entries WHERE index_kind = ? AND address = ?",
            Long.class,
            kind.name(), address
        );
        return count != null ? count : 0L;
    }

    public List<Long> slice(OrderIndexKind kind, String address, long start, int length) {
        return jdbcTemplate.queryForList(
            "SELECT order_id FROM order_index_entries " +
            "WHERE index_kind = ? AND address = ? AND position >= ? AND position < ? " +
            "ORDER BY position",
            Long.class,
            kind.name(), address, start, start + length
        );
    }
}
