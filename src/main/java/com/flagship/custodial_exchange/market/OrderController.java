package com.flagship.custodial_exchange.market;

import com.flagship.custodial_exchange.idempotency.IdempotencyService;
import com.flagship.custodial_exchange.market.dto.BuyOrderRequest;
import com.flagship.custodial_exchange.market.dto.CountResponse;
import com.flagship.custodial_exchange.market.dto.CreateOrderRequest;
import com.flagship.custodial_exchange.market.dto.OrderPageResponse;
import com.flagship.custodial_exchange.market.dto.OrderResponse;
import com.flagship.custodial_exchange.market.dto.UpdatePriceRequest;
import com.flagship.custodial_exchange.observability.ExchangeMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * REST controller for the order escrow market.
 *
 * The acting address comes from {@code X-Caller-Address}. Listing requires an
 * {@code Idempotency-Key}; a repeated key returns the order it created the
 * first time instead of listing again.
 */
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
@Slf4j
public class OrderController {

    private static final String CALLER_HEADER = "X-Caller-Address";
    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final OrderEscrowService orderEscrowService;
    private final IdempotencyService idempotencyService;
    private final ExchangeMetrics metrics;

    @PostMapping
    @Transactional
    public ResponseEntity<OrderResponse> createOrder(
            @RequestHeader(CALLER_HEADER) String caller,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @Valid @RequestBody CreateOrderRequest request) {

        log.info("Received order creation request: idempotencyKey={}, asset={}, price={}",
                idempotencyKey, request.getAssetId(), request.getPrice());

        Optional<Long> existingId = idempotencyService.lookup(IdempotencyService.ORDER, caller, idempotencyKey);
        if (existingId.isPresent()) {
            metrics.recordIdempotencyHit();
            log.info("Idempotency key already used, returning existing order {}", existingId.get());
            return ResponseEntity.ok(OrderResponse.from(orderEscrowService.getOrder(existingId.get())));
        }
        metrics.recordIdempotencyMiss();

        Order order = orderEscrowService.createOrder(caller, request.getAssetId(), request.getPrice());
        idempotencyService.store(IdempotencyService.ORDER, caller, idempotencyKey, order.getId());

        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.from(order));
    }

    @PutMapping("/{id}/price")
    public ResponseEntity<OrderResponse> updatePrice(@RequestHeader(CALLER_HEADER) String caller,
                                                     @PathVariable("id") long id,
                                                     @Valid @RequestBody UpdatePriceRequest request) {
        return ResponseEntity.ok(OrderResponse.from(
            orderEscrowService.updateOrder(caller, id, request.getPrice())));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<OrderResponse> cancel(@RequestHeader(CALLER_HEADER) String caller,
                                                @PathVariable("id") long id) {
        return ResponseEntity.ok(OrderResponse.from(orderEscrowService.cancelOrder(caller, id)));
    }

    @PostMapping("/{id}/buy")
    public ResponseEntity<OrderResponse> buy(@RequestHeader(CALLER_HEADER) String caller,
                                             @PathVariable("id") long id,
                                             @Valid @RequestBody BuyOrderRequest request) {
        return ResponseEntity.ok(OrderResponse.from(
            orderEscrowService.buyOrder(caller, id, request.getAmount())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable("id") long id) {
        return ResponseEntity.ok(OrderResponse.from(orderEscrowService.getOrder(id)));
    }

    @GetMapping("/owned/{address}/count")
    public ResponseEntity<CountResponse> countOwned(@PathVariable("address") String address) {
        return ResponseEntity.ok(new CountResponse(address, orderEscrowService.countOwnedOrders(address)));
    }

    @GetMapping("/owned/{address}")
    public ResponseEntity<OrderPageResponse> fetchOwned(@PathVariable("address") String address,
                                                        @RequestParam(name = "cursor", defaultValue = "0") long cursor,
                                                        @RequestParam(name = "size", defaultValue = "20") int size) {
        return ResponseEntity.ok(OrderPageResponse.from(
            orderEscrowService.fetchOwnedOrders(address, cursor, size)));
    }

    @GetMapping("/bought/{address}/count")
    public ResponseEntity<CountResponse> countBought(@PathVariable("address") String address) {
        return ResponseEntity.ok(new CountResponse(address, orderEscrowService.countBoughtOrders(address)));
    }

    @GetMapping("/bought/{address}")
    public ResponseEntity<OrderPageResponse> fetchBought(@PathVariable("address") String address,
                                                         @RequestParam(name = "cursor", defaultValue = "0") long cursor,
                                                         @RequestParam(name = "size", defaultValue = "20") int size) {
        return ResponseEntity.ok(OrderPageResponse.from(
            orderEscrowService.fetchBoughtOrders(address, cursor, size)));
    }
}
