package com.lineguard.api.controller;

import com.lineguard.api.dto.PriceValidationBatchResponse;
import com.lineguard.api.dto.PriceValidationRequest;
import com.lineguard.api.dto.PriceValidationResponse;
import com.lineguard.pipeline.PriceCheckRequest;
import com.lineguard.pipeline.PriceValidationService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * POST /api/v1/items/validate-price, single check or batch of up to 50.
 */
@RestController
@RequestMapping("/api/v1/items")
@RequiredArgsConstructor
public class PriceValidationController {

    private final PriceValidationService priceValidationService;

    @PostMapping("/validate-price")
    public ResponseEntity<?> validatePrice(@RequestBody PriceValidationRequest request) {
        if (request.isBatch()) {
            List<PriceCheckRequest> checks = request.items().stream()
                    .map(i -> new PriceCheckRequest(i.lineItemId(), i.canonicalItemId(), i.unitPrice(), i.currency(), i.itemName()))
                    .toList();
            return ResponseEntity.ok(PriceValidationBatchResponse.of(priceValidationService.checkBatch(checks)));
        }
        PriceCheckRequest check = new PriceCheckRequest(request.lineItemId(), request.canonicalItemId(),
                request.unitPrice(), request.currency(), request.itemName());
        return ResponseEntity.ok(PriceValidationResponse.of(request.lineItemId(), priceValidationService.check(check)));
    }
}
