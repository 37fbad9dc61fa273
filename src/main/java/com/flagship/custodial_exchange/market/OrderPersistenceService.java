package com.flagship.custodial_exchange.market;

import com.flagship.custodial_exchange.exception.EscrowException;
import com.flagship.custodial_exchange.pagination.CursorPage;
import com.flagship.custodial_exchange.persistence.RecordCounters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Bridges the {@link Order} domain object and its storage: the orders table,
 * the id counter and the owner/buyer indices.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderPersistenceService {

    private final OrderRepository orderRepository;
    private final OrderIndexStore indexStore;
    private final RecordCounters recordCounters;

    /**
     * Next order id; counting starts at 0.
     */
    @Transactional
    public long nextOrderId() {
        return recordCounters.next(RecordCounters.ORDER);
    }

    /**
     * Stores a new order and appends it to the seller's owned index.
     */
    @Transactional
    public Order insert(Order order) {
        OrderEntity saved = orderRepository.saveAndFlush(OrderEntity.fromDomain(order));
        indexStore.append(OrderIndexKind.OWNED, order.getSeller(), order.getId());
        log.debug("Saved order {} for seller {}", saved.getId(), saved.getSeller());
        return saved.toDomain();
    }

    /**
     * Loads and row-locks an order for a write operation.
     *
     * @throws EscrowException NOT_FOUND if the order does not exist
     */
    @Transactional
    public Order lockById(long orderId) {
        return orderRepository.findByIdForUpdate(orderId)
            .map(OrderEntity::toDomain)
            .orElseThrow(() -> EscrowException.notFound("Order not found: %d", orderId));
    }

    @Transactional(readOnly = true)
    public Optional<Order> findById(long orderId) {
        return orderRepository.findById(orderId).map(OrderEntity::toDomain);
    }

    /**
     * Writes a transition and flushes it, so the new state is in the database
     * before any custody or value moves.
     */
    @Transactional
    public Order update(Order order) {
        OrderEntity existing = orderRepository.findById(order.getId())
            .orElseThrow(() -> EscrowException.notFound("Order not found: %d", order.getId()));
        existing.updateFromDomain(order);
        OrderEntity updated = orderRepository.saveAndFlush(existing);
        log.debug("Updated order {} to {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional
    public void recordPurchase(String buyer, long orderId) {
        indexStore.append(OrderIndexKind.BOUGHT, buyer, orderId);
    }

    @Transactional(readOnly = true)
    public long count(OrderIndexKind kind, String address) {
        return indexStore.count(kind, address);
    }

    @Transactional(readOnly = true)
    public CursorPage<Long> fetchPage(OrderIndexKind kind, String address, long cursor, int howMany) {
        return CursorPage.fetchPage(indexStore.count(kind, address), cursor, howMany,
            (start, length) -> indexStore.slice(kind, address, start, length));
    }

    @Transactional(readOnly = true)
    public long countActive() {
        return orderRepository.countByStatus(OrderStatus.ACTIVE);
    }
}
