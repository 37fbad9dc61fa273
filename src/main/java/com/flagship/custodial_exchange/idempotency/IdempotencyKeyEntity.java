package com.flagship.custodial_exchange.idempotency;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable record of a consumed idempotency key.
 *
 * The key column holds the scoped key ({@code resource:caller:key}); its
 * primary-key constraint turns a concurrent duplicate create into a rollback.
 */
@Entity
@Table(name = "idempotency_keys")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class IdempotencyKeyEntity {

    @Id
    @Column(name = "scoped_key", nullable = false, updatable = false, length = 400)
    private String scopedKey;

    @Column(name = "resource_type", nullable = false, updatable = false, length = 20)
    private String resourceType;

    @Column(name = "resource_id", nullable = false, updatable = false)
    private long resourceId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
