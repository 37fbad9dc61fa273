package com.flagship.custodial_exchange.registry;

import com.flagship.custodial_exchange.exception.EscrowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * JDBC-backed {@link AssetRegistry}.
 *
 * The asset row is locked while custody moves, so two transfers of one asset
 * cannot both pass the holder check.
 */
@Service
@Slf4j
public class AssetRegistryService implements AssetRegistry {

    private final JdbcTemplate jdbcTemplate;

    public AssetRegistryService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Registers a new asset held by {@code owner}.
     */
    @Transactional
    public void mint(String assetId, String owner) {
        if (assetId == null || assetId.isBlank() || owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("Asset id and owner are required");
        }
        int inserted = jdbcTemplate.update(
            "INSERT INTO assets (asset_id, owner_address, created_at, updated_at) " +
            "VALUES (?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) ON CONFLICT (asset_id) DO NOTHING",
            assetId, owner
        );
        if (inserted == 0) {
            throw EscrowException.alreadyInState("Asset %s already exists", assetId);
        }
        log.info("Minted asset {} to {}", assetId, owner);
    }

    @Override
    @Transactional(readOnly = true)
    public String ownerOf(String assetId) {
        String owner = jdbcTemplate.query(
            "SELECT owner_address FROM assets WHERE asset_id = ?",
            rs -> rs.next() ? rs.getString("owner_address") : null,
            assetId
        );
        if (owner == null) {
            throw EscrowException.notFound("Asset not found: %s", assetId);
        }
        return owner;
    }

    @Override
    @Transactional
    public void transferCustody(String from, String to, String assetId) {
        if (to == null || to.isBlank()) {
            throw new IllegalArgumentException("Recipient is required");
        }
        String owner = jdbcTemplate.query(
            "SELECT owner_address FROM assets WHERE asset_id = ? FOR UPDATE",
            rs -> rs.next() ? rs.getString("owner_address") : null,
            assetId
        );
        if (owner == null) {
            throw EscrowException.notFound("Asset not found: %s", assetId);
        }
        if (!owner.equals(from)) {
            throw EscrowException.unauthorized("%s does not hold asset %s", from, assetId);
        }

        jdbcTemplate.update(
            "UPDATE assets SET owner_address = ?, updated_at = CURRENT_TIMESTAMP WHERE asset_id = ?",
            to, assetId
        );
        log.debug("Asset {} custody moved {} -> {}", assetId, from, to);
    }
}
