package com.flagship.custodial_exchange.registry;

/**
 * Registry of uniquely identified assets and their current holder.
 */
public interface AssetRegistry {

    /**
     * @throws com.flagship.custodial_exchange.exception.EscrowException with
     *         {@code NOT_FOUND} for an unknown asset
     */
    String ownerOf(String assetId);

    /**
     * Moves custody of {@code assetId} from {@code from} to {@code to}.
     *
     * @throws com.flagship.custodial_exchange.exception.EscrowException with
     *         {@code UNAUTHORIZED} if {@code from} is not the current holder
     */
    void transferCustody(String from, String to, String assetId);
}
