package com.flagship.custodial_exchange.lobby;

/**
 * Phase of a lobby at a given instant. Derived from the stored fields and the
 * clock; never persisted.
 */
public enum LobbyPhase {
    /** Before start, waiting for a joiner. */
    OPEN,
    /** Before start, both stakes escrowed. */
    JOINED,
    /** Joined and inside the five-minute game window. */
    IN_PROGRESS,
    /** Past the game window, or past start without a joiner. */
    ENDED,
    CANCELED
}
