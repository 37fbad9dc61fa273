package com.flagship.custodial_exchange.ledger;

import com.flagship.custodial_exchange.config.ExchangeProperties;
import com.flagship.custodial_exchange.exception.EscrowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Double-entry value ledger backing {@link ValueLedger}.
 *
 * Invariants:
 * 1. Every transfer writes one debit and one credit of equal amount
 *    (a deferred database trigger re-checks this at commit)
 * 2. Entries are immutable; balances are derived from them, never stored
 * 3. No account except the issuer may go below zero
 *
 * The payer's account row is locked before its balance is read, so concurrent
 * transfers out of one account are serialized.
 */
@Service
@Slf4j
public class LedgerService implements ValueLedger {

    private final JdbcTemplate jdbcTemplate;
    private final String issuerAddress;

    public LedgerService(JdbcTemplate jdbcTemplate, ExchangeProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.issuerAddress = properties.getLedger().getIssuerAddress();
    }

    /**
     * Credits {@code amount} to {@code to}, funded by the issuer account.
     *
     * @return id of the transfer, or {@code null} for a zero amount
     */
    @Transactional
    public UUID deposit(String to, long amount) {
        UUID transferId = post(issuerAddress, to, amount, "Deposit to " + to);
        log.info("Deposited {} to {}", amount, to);
        return transferId;
    }

    @Override
    @Transactional
    public void transfer(String from, String to, long amount) {
        post(from, to, amount, String.format("Transfer %s -> %s", from, to));
    }

    @Override
    @Transactional
    public void transferFrom(String spender, String from, String to, long amount) {
        requireAmount(amount);
        if (amount == 0) {
            return;
        }

        Long allowance = jdbcTemplate.query(
            "SELECT amount FROM value_allowances WHERE owner_address = ? AND spender_address = ? FOR UPDATE",
            rs -> rs.next() ? rs.getLong("amount") : null,
            from, spender
        );
        long granted = allowance != null ? allowance : 0L;
        if (granted < amount) {
            throw EscrowException.insufficientFunds(
                "Allowance of %s for %s is %d, transfer needs %d", from, spender, granted, amount);
        }

        jdbcTemplate.update(
            "UPDATE value_allowances SET amount = amount - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE owner_address = ? AND spender_address = ?",
            amount, from, spender
        );

        post(from, to, amount, String.format("Transfer %s -> %s by %s", from, to, spender));
    }

    /**
     * Sets the allowance {@code owner} grants to {@code spender}, replacing any
     * previous value.
     */
    @Transactional
    public void approve(String owner, String spender, long amount) {
        requireAmount(amount);
        requireAddress(owner);
        requireAddress(spender);
        jdbcTemplate.update(
            "INSERT INTO value_allowances (owner_address, spender_address, amount, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (owner_address, spender_address) " +
            "DO UPDATE SET amount = EXCLUDED.amount, updated_at = EXCLUDED.updated_at",
            owner, spender, amount
        );
        log.debug("Allowance set: owner={}, spender={}, amount={}", owner, spender, amount);
    }

    @Transactional(readOnly = true)
    public long allowance(String owner, String spender) {
        Long amount = jdbcTemplate.query(
            "SELECT amount FROM value_allowances WHERE owner_address = ? AND spender_address = ?",
            rs -> rs.next() ? rs.getLong("amount") : null,
            owner, spender
        );
        return amount != null ? amount : 0L;
    }

    /**
     * Balance derived from ledger entries: credits minus debits.
     * Unknown addresses have a zero balance.
     */
    @Override
    @Transactional(readOnly = true)
    public long balanceOf(String address) {
        Long balance = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN entry_type = 'CREDIT' THEN amount ELSE -amount END), 0) " +
            "FROM value_entries WHERE address = ?",
            Long.class,
            address
        );
        return balance != null ? balance : 0L;
    }

    /**
     * All entries of one transfer, in write order.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> getEntriesForTransfer(UUID transferId) {
        return jdbcTemplate.query(
            "SELECT id, transfer_id, address, amount, entry_type, description, sequence_number " +
            "FROM value_entries WHERE transfer_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            transferId
        );
    }

    private UUID post(String from, String to, long amount, String description) {
        requireAmount(amount);
        requireAddress(from);
        requireAddress(to);
        if (amount == 0) {
            return null;
        }
        if (from.equals(to)) {
            throw new IllegalArgumentException("Cannot transfer to the same account: " + from);
        }

        ensureAccount(from);
        ensureAccount(to);

        // Lock the payer so the balance check below cannot race another debit
        jdbcTemplate.queryForObject(
            "SELECT address FROM value_accounts WHERE address = ? FOR UPDATE",
            String.class,
            from
        );

        if (!from.equals(issuerAddress)) {
            long available = balanceOf(from);
            if (available < amount) {
                throw EscrowException.insufficientFunds(
                    "Balance of %s is %d, transfer needs %d", from, available, amount);
            }
        }

        UUID transferId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO value_transfers (id, description, created_at) VALUES (?, ?, CURRENT_TIMESTAMP)",
            transferId,
            description
        );
        createEntry(transferId, from, amount, EntryType.DEBIT, description);
        createEntry(transferId, to, amount, EntryType.CREDIT, description);

        log.debug("Posted transfer {}: {} -> {} amount={}", transferId, from, to, amount);
        return transferId;
    }

    private void createEntry(UUID transferId, String address, long amount,
                             EntryType entryType, String description) {
        jdbcTemplate.update(
            "INSERT INTO value_entries (id, transfer_id, address, amount, entry_type, description, created_at) " +
            "VALUES (gen_random_uuid(), ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            transferId,
            address,
            amount,
            entryType.name(),
            description
        );
    }

    private void ensureAccount(String address) {
        jdbcTemplate.update(
            "INSERT INTO value_accounts (address, created_at) VALUES (?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (address) DO NOTHING",
            address
        );
    }

    private static void requireAmount(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount must not be negative: " + amount);
        }
    }

    private static void requireAddress(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address is required");
        }
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> new LedgerEntry(
            UUID.fromString(rs.getString("id")),
            UUID.fromString(rs.getString("transfer_id")),
            rs.getString("address"),
            rs.getLong("amount"),
            EntryType.valueOf(rs.getString("entry_type")),
            rs.getString("description"),
            rs.getLong("sequence_number")
        );
    }
}
