package com.flagship.custodial_exchange.market;

import com.flagship.custodial_exchange.exception.EscrowException;
import lombok.Value;

import java.time.Instant;

/**
 * Order domain object.
 *
 * Key rules:
 * - ACTIVE -> CANCELED or ACTIVE -> SOLD, both terminal
 * - buyer is set if and only if status is SOLD
 * - price changes only while ACTIVE and only by the seller
 *
 * Transitions return a new instance; the receiver is never modified.
 */
@Value
public class Order {
    long id;
    OrderStatus status;
    String assetId;
    String seller;
    String buyer;
    long price;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new ACTIVE order.
     */
    public static Order list(long id, String assetId, String seller, long price) {
        if (assetId == null || assetId.isBlank()) {
            throw new IllegalArgumentException("Asset id is required");
        }
        requireCaller(seller);
        requirePrice(price);
        return new Order(id, OrderStatus.ACTIVE, assetId, seller, null, price, null, null);
    }

    /**
     * Changes the asking price.
     *
     * @throws EscrowException INVALID_STATE unless ACTIVE, UNAUTHORIZED unless caller is the seller
     */
    public Order reprice(String caller, long newPrice) {
        requirePrice(newPrice);
        requireActive("update");
        requireSeller(caller, "update");
        return new Order(id, status, assetId, seller, buyer, newPrice, createdAt, updatedAt);
    }

    /**
     * Withdraws the order.
     *
     * @throws EscrowException INVALID_STATE unless ACTIVE, UNAUTHORIZED unless caller is the seller
     */
    public Order cancel(String caller) {
        requireActive("cancel");
        requireSeller(caller, "cancel");
        return new Order(id, OrderStatus.CANCELED, assetId, seller, null, price, createdAt, updatedAt);
    }

    /**
     * Sells the order to {@code caller}.
     *
     * {@code amount} must equal the current price exactly: it protects the buyer
     * from a price change that landed between reading the order and submitting.
     *
     * @throws EscrowException INVALID_STATE unless ACTIVE, AMOUNT_MISMATCH if amount differs from price
     */
    public Order sell(String caller, long amount) {
        requireCaller(caller);
        requireActive("buy");
        if (amount != price) {
            throw EscrowException.amountMismatch(
                "Order %d costs %d, submitted amount was %d", id, price, amount);
        }
        return new Order(id, OrderStatus.SOLD, assetId, seller, caller, price, createdAt, updatedAt);
    }

    public boolean isTerminal() {
        return status == OrderStatus.CANCELED || status == OrderStatus.SOLD;
    }

    private void requireActive(String operation) {
        if (status != OrderStatus.ACTIVE) {
            throw EscrowException.invalidState(
                "Cannot %s order %d in %s status. Only ACTIVE orders accept changes.", operation, id, status);
        }
    }

    private void requireSeller(String caller, String operation) {
        if (!seller.equals(caller)) {
            throw EscrowException.unauthorized("Only the seller may %s order %d", operation, id);
        }
    }

    private static void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw new IllegalArgumentException("Caller address is required");
        }
    }

    private static void requirePrice(long price) {
        if (price < 0) {
            throw new IllegalArgumentException("Price must not be negative: " + price);
        }
    }
}
