package com.lineguard.api.controller;

import com.lineguard.api.dto.ProposalDecisionRequest;
import com.lineguard.api.dto.ProposalResponse;
import com.lineguard.domain.ProposalStatus;
import com.lineguard.proposal.ProposalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Operator review of catalog and band proposals.
 */
@RestController
@RequestMapping("/api/v1/proposals")
@RequiredArgsConstructor
public class ProposalController {

    private final ProposalService proposalService;

    @GetMapping
    public ResponseEntity<List<ProposalResponse>> list(@RequestParam(required = false) ProposalStatus status) {
        return ResponseEntity.ok(proposalService.list(status).stream().map(ProposalResponse::of).toList());
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<ProposalResponse> approve(@PathVariable String id,
                                                    @Valid @RequestBody(required = false) ProposalDecisionRequest request) {
        return ResponseEntity.ok(ProposalResponse.of(proposalService.approve(id, note(request))));
    }

    @PostMapping("/{id}/deny")
    public ResponseEntity<ProposalResponse> deny(@PathVariable String id,
                                                 @Valid @RequestBody(required = false) ProposalDecisionRequest request) {
        return ResponseEntity.ok(ProposalResponse.of(proposalService.deny(id, note(request))));
    }

    private static String note(ProposalDecisionRequest request) {
        return request != null ? request.note() : null;
    }
}
