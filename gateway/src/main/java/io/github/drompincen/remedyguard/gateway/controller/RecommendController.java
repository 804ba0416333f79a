package io.github.drompincen.remedyguard.gateway.controller;

import io.github.drompincen.remedyguard.protocol.api.DecisionRecord;
import io.github.drompincen.remedyguard.protocol.api.RecommendRequest;
import io.github.drompincen.remedyguard.protocol.error.InputException;
import io.github.drompincen.remedyguard.runtime.gate.ApprovalGate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Single-threat decisions. Gate failures surface through {@link ErrorHandler}.
 */
@RestController
public class RecommendController {

    private final ApprovalGate approvalGate;

    public RecommendController(ApprovalGate approvalGate) {
        this.approvalGate = approvalGate;
    }

    @PostMapping("/recommend")
    public ResponseEntity<DecisionRecord> recommend(@RequestBody RecommendRequest request) {
        if (request == null || request.threat() == null) {
            throw new InputException("threat is required");
        }
        return ResponseEntity.ok(approvalGate.decide(request.threat(), request.confirm()));
    }
}
