package com.lineguard.api.controller;

import com.lineguard.api.dto.MatchRequest;
import com.lineguard.matching.CatalogMatcher;
import com.lineguard.matching.MatchOutcome;
import com.lineguard.matching.MatchQuery;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * POST /api/v1/items/match, single item or batch.
 */
@RestController
@RequestMapping("/api/v1/items")
@RequiredArgsConstructor
public class MatchController {

    private final CatalogMatcher catalogMatcher;

    @PostMapping("/match")
    public ResponseEntity<?> match(@Valid @RequestBody MatchRequest request) {
        if (request.isBatch()) {
            List<MatchQuery> queries = request.items().stream()
                    .map(i -> new MatchQuery(i.lineItemId(), i.itemName(), i.itemDescription(), Boolean.TRUE.equals(i.forceMatcher())))
                    .toList();
            return ResponseEntity.ok(catalogMatcher.matchBatch(queries));
        }
        boolean force = Boolean.TRUE.equals(request.forceMatcher());
        MatchOutcome outcome = MatchOutcome.of(
                catalogMatcher.match(request.itemName(), request.itemDescription(), force).withLineItemId(request.lineItemId()));
        return ResponseEntity.ok(outcome);
    }
}
