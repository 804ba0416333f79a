package io.github.drompincen.remedyguard.gateway.controller;

import io.github.drompincen.remedyguard.persistence.audit.AuditLog;
import io.github.drompincen.remedyguard.protocol.api.AuditEntry;
import io.github.drompincen.remedyguard.protocol.api.AuditVerifyReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditLog auditLog;

    public AuditController(AuditLog auditLog) {
        this.auditLog = auditLog;
    }

    @GetMapping
    public List<AuditEntry> latest(@RequestParam(defaultValue = "100") int limit) {
        return auditLog.latest(limit);
    }

    @GetMapping("/verify")
    public AuditVerifyReport verify() {
        return auditLog.verify();
    }
}
