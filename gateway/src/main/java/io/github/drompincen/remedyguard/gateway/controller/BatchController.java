package io.github.drompincen.remedyguard.gateway.controller;

import io.github.drompincen.remedyguard.protocol.api.BatchReport;
import io.github.drompincen.remedyguard.protocol.api.BatchRequest;
import io.github.drompincen.remedyguard.runtime.batch.BatchOrchestrator;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class BatchController {

    private final BatchOrchestrator batchOrchestrator;

    public BatchController(BatchOrchestrator batchOrchestrator) {
        this.batchOrchestrator = batchOrchestrator;
    }

    @PostMapping("/batch")
    public BatchReport batch(@RequestBody BatchRequest request) {
        return batchOrchestrator.runBatch(request != null ? request.threats() : List.of());
    }
}
