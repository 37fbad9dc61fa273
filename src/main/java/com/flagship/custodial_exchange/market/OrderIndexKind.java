package com.flagship.custodial_exchange.market;

/**
 * Per-address order indices, both append-only.
 */
public enum OrderIndexKind {
    /** Orders listed by an address, in creation order. */
    OWNED,

    /** Orders bought by an address, in purchase order. */
    BOUGHT
}
