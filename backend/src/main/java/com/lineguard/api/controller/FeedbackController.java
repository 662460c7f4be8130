package com.lineguard.api.controller;

import com.lineguard.api.dto.FeedbackResponse;
import com.lineguard.proposal.FeedbackDecision;
import com.lineguard.proposal.FeedbackResult;
import com.lineguard.proposal.FeedbackService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/v1/feedback. Write-only.
 */
@RestController
@RequestMapping("/api/v1/feedback")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackService feedbackService;

    @PostMapping
    public ResponseEntity<FeedbackResponse> submit(@Valid @RequestBody FeedbackDecision decision) {
        FeedbackResult result = feedbackService.apply(decision);
        return ResponseEntity.ok(new FeedbackResponse(result.success(), result.message()));
    }
}
