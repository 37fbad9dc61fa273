package com.flagship.custodial_exchange.market;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for orders.
 *
 * - No setters: only {@link #updateFromDomain(Order)} changes state
 * - id, asset and seller are fixed at insert
 * - Rows are never deleted
 */
@Entity
@Table(
    name = "orders",
    indexes = {
        @Index(name = "idx_orders_status", columnList = "status"),
        @Index(name = "idx_orders_seller", columnList = "seller_address")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderStatus status;

    @Column(name = "asset_id", nullable = false, updatable = false)
    private String assetId;

    @Column(name = "seller_address", nullable = false, updatable = false)
    private String seller;

    @Column(name = "buyer_address")
    private String buyer;

    @Column(nullable = false)
    private long price;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static OrderEntity fromDomain(Order order) {
        return new OrderEntity(
            order.getId(),
            order.getStatus(),
            order.getAssetId(),
            order.getSeller(),
            order.getBuyer(),
            order.getPrice(),
            null, // set by @PrePersist
            null
        );
    }

    public Order toDomain() {
        return new Order(id, status, assetId, seller, buyer, price, createdAt, updatedAt);
    }

    /**
     * Copies the mutable fields (status, buyer, price). A terminal row cannot be
     * rewritten: this is the last line of defence behind the domain checks.
     */
    void updateFromDomain(Order order) {
        if (this.status != OrderStatus.ACTIVE) {
            throw new IllegalStateException(
                "Order " + this.id + " is " + this.status + " and can no longer change");
        }
        this.status = order.getStatus();
        this.buyer = order.getBuyer();
        this.price = order.getPrice();
    }
}
