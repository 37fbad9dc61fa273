package com.flagship.custodial_exchange.ledger;

import com.flagship.custodial_exchange.ledger.dto.ApproveRequest;
import com.flagship.custodial_exchange.ledger.dto.BalanceResponse;
import com.flagship.custodial_exchange.ledger.dto.DepositRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST surface of the bundled value ledger: funding, allowances and balances.
 *
 * Callers approve an escrow custody address here before buying an order or
 * staking in a lobby.
 */
@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private static final String CALLER_HEADER = "X-Caller-Address";

    private final LedgerService ledgerService;

    @PostMapping("/deposits")
    public ResponseEntity<BalanceResponse> deposit(@Valid @RequestBody DepositRequest request) {
        ledgerService.deposit(request.getAddress(), request.getAmount());
        return ResponseEntity.ok(new BalanceResponse(
            request.getAddress(), ledgerService.balanceOf(request.getAddress())));
    }

    @PostMapping("/approvals")
    public ResponseEntity<Void> approve(@RequestHeader(CALLER_HEADER) String caller,
                                        @Valid @RequestBody ApproveRequest request) {
        ledgerService.approve(caller, request.getSpender(), request.getAmount());
        log.info("Approval recorded: owner={}, spender={}, amount={}",
                caller, request.getSpender(), request.getAmount());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/balances/{address}")
    public ResponseEntity<BalanceResponse> balance(@PathVariable("address") String address) {
        return ResponseEntity.ok(new BalanceResponse(address, ledgerService.balanceOf(address)));
    }
}
