package com.flagship.custodial_exchange.market;

/**
 * Order status. ACTIVE is the only state any write operation accepts.
 */
public enum OrderStatus {
    /**
     * Listed; the market holds the asset in custody.
     */
    ACTIVE,

    /**
     * Withdrawn by the seller; asset returned. Terminal.
     */
    CANCELED,

    /**
     * Bought; payment distributed and asset released to the buyer. Terminal.
     */
    SOLD
}
