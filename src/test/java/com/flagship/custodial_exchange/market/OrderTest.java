package com.flagship.custodial_exchange.market;

import com.flagship.custodial_exchange.exception.EscrowException;
import com.flagship.custodial_exchange.exception.Violation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OrderTest {

    private static final String SELLER = "alice";
    private static final String BUYER = "bob";

    private Order active() {
        return Order.list(7, "sword-1", SELLER, 1000);
    }

    private void assertViolation(Violation expected, Runnable action) {
        EscrowException e = assertThrows(EscrowException.class, action::run);
        assertEquals(expected, e.getViolation(), e.getMessage());
    }

    @Test
    @DisplayName("A new order is ACTIVE without buyer")
    void testList() {
        Order order = active();

        assertEquals(OrderStatus.ACTIVE, order.getStatus());
        assertNull(order.getBuyer());
        assertFalse(order.isTerminal());
    }

    @Test
    @DisplayName("Seller can reprice; others cannot")
    void testReprice() {
        Order repriced = active().reprice(SELLER, 1200);
        assertEquals(1200, repriced.getPrice());
        assertEquals(1000, active().getPrice(), "transitions do not modify the receiver");

        assertViolation(Violation.UNAUTHORIZED, () -> active().reprice(BUYER, 1200));
    }

    @Test
    @DisplayName("Cancel moves to CANCELED and blocks every further transition")
    void testCancelIsTerminal() {
        Order canceled = active().cancel(SELLER);

        assertEquals(OrderStatus.CANCELED, canceled.getStatus());
        assertTrue(canceled.isTerminal());
        assertViolation(Violation.INVALID_STATE, () -> canceled.cancel(SELLER));
        assertViolation(Violation.INVALID_STATE, () -> canceled.reprice(SELLER, 1));
        assertViolation(Violation.INVALID_STATE, () -> canceled.sell(BUYER, 1000));
    }

    @Test
    @DisplayName("Sell requires the exact price and records the buyer")
    void testSell() {
        assertViolation(Violation.AMOUNT_MISMATCH, () -> active().sell(BUYER, 999));
        assertViolation(Violation.AMOUNT_MISMATCH, () -> active().sell(BUYER, 1001));

        Order sold = active().sell(BUYER, 1000);
        assertEquals(OrderStatus.SOLD, sold.getStatus());
        assertEquals(BUYER, sold.getBuyer());
        assertViolation(Violation.INVALID_STATE, () -> sold.sell("carol", 1000));
    }

    @Test
    @DisplayName("State is checked before role: a stranger canceling a sold order gets INVALID_STATE")
    void testCheckOrder() {
        Order sold = active().sell(BUYER, 1000);
        assertViolation(Violation.INVALID_STATE, () -> sold.cancel("mallory"));
    }

    @Test
    @DisplayName("Negative prices and blank assets are invalid arguments")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> Order.list(1, "sword-1", SELLER, -1));
        assertThrows(IllegalArgumentException.class, () -> Order.list(1, " ", SELLER, 10));
        assertThrows(IllegalArgumentException.class, () -> active().reprice(SELLER, -5));
    }
}
