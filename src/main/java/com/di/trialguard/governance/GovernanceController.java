package com.di.trialguard.governance;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/governance")
@RequiredArgsConstructor
public class GovernanceController {

    private final PromotionService promotionService;

    /** Runs the promotion gate. 200 for every decision, quarantine included. */
    @PostMapping(value = "/promote",
            consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PromotionResult> promote(@Valid @RequestBody PromotionRequest request) {
        return ResponseEntity.ok(promotionService.promote(request));
    }
}
