package com.flagship.custodial_exchange.lobby;

import lombok.Value;

/**
 * Per-participant accrual state inside one lobby.
 *
 * Created lazily with a closed valve and zero balances. {@code lastUpdatedAt}
 * (epoch seconds, 0 until the first checkpoint) advances on every mutating
 * access through a {@link com.flagship.custodial_exchange.lobby.accrual.MeadAccrualPolicy}.
 */
@Value
public class BreweryStatus {
    long lobbyId;
    String address;
    long mead;
    long points;
    boolean valveOpened;
    long lastUpdatedAt;
    long meadPerSecond;

    public static BreweryStatus initial(long lobbyId, String address, long meadPerSecond) {
        return new BreweryStatus(lobbyId, address, 0, 0, false, 0, meadPerSecond);
    }

    public BreweryStatus checkpointed(long newMead, long now) {
        return new BreweryStatus(lobbyId, address, newMead, points, valveOpened, now, meadPerSecond);
    }

    public BreweryStatus withValve(boolean open) {
        return new BreweryStatus(lobbyId, address, mead, points, open, lastUpdatedAt, meadPerSecond);
    }
}
