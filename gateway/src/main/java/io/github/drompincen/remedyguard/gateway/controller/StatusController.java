package io.github.drompincen.remedyguard.gateway.controller;

import io.github.drompincen.remedyguard.persistence.audit.AuditLog;
import io.github.drompincen.remedyguard.runtime.classify.DestructiveClassifier;
import io.github.drompincen.remedyguard.runtime.gate.ApprovalGate;
import io.github.drompincen.remedyguard.runtime.generation.GenerationClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

@RestController
@RequestMapping("/api/status")
public class StatusController {

    private final GenerationClient generationClient;
    private final AuditLog auditLog;
    private final DestructiveClassifier classifier;
    private final ApprovalGate approvalGate;

    public StatusController(GenerationClient generationClient, AuditLog auditLog,
                            DestructiveClassifier classifier, ApprovalGate approvalGate) {
        this.generationClient = generationClient;
        this.auditLog = auditLog;
        this.classifier = classifier;
        this.approvalGate = approvalGate;
    }

    @GetMapping
    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("provider", generationClient.getProviderInfo());
        status.put("available", generationClient.isAvailable());
        status.put("generationTimeoutMs", approvalGate.generationTimeout().toMillis());
        status.put("auditSink", auditLog.describe());
        status.put("classifierTerms", new TreeSet<>(classifier.terms()));
        return status;
    }
}
