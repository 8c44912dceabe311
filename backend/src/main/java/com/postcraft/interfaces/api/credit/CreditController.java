package com.postcraft.interfaces.api.credit;

import com.postcraft.domain.credit.service.CreditMeteringService;
import com.postcraft.interfaces.api.dto.CreditBalanceResponse;
import com.postcraft.interfaces.api.dto.CreditGrantRequest;
import com.postcraft.interfaces.api.dto.CreditLedgerEntryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;

@RestController
@RequestMapping("/api/v1/credits")
@RequiredArgsConstructor
public class CreditController {

    private final CreditMeteringService creditMeteringService;

    @GetMapping("/{accountId}")
    public ResponseEntity<CreditBalanceResponse> getBalance(@PathVariable String accountId) {
        return ResponseEntity.ok(new CreditBalanceResponse(accountId, creditMeteringService.balance(accountId)));
    }

    @GetMapping("/{accountId}/ledger")
    public ResponseEntity<List<CreditLedgerEntryResponse>> getLedger(@PathVariable String accountId) {
        return ResponseEntity.ok(creditMeteringService.history(accountId).stream()
                .map(CreditLedgerEntryResponse::from)
                .toList());
    }

    @PostMapping("/{accountId}/grants")
    public ResponseEntity<CreditBalanceResponse> grant(@PathVariable String accountId,
                                                       @Valid @RequestBody CreditGrantRequest request) {
        BigDecimal balance = creditMeteringService.grant(accountId, request.amount());
        return ResponseEntity.ok(new CreditBalanceResponse(accountId, balance));
    }
}
