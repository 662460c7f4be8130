package com.lineguard.api.controller;

import com.lineguard.api.dto.SafetyScanResponse;
import com.lineguard.proposal.SafetyScanner;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/safety-scan")
@RequiredArgsConstructor
public class SafetyScanController {

    private final SafetyScanner safetyScanner;

    @PostMapping
    public ResponseEntity<SafetyScanResponse> scan() {
        return ResponseEntity.ok(SafetyScanResponse.of(safetyScanner.scan()));
    }
}
