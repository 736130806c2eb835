package org.lite.snapshot.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.dto.ArchivalResult;
import org.lite.snapshot.dto.AuditLogPageResponse;
import org.lite.snapshot.dto.AuditLogQueryRequest;
import org.lite.snapshot.dto.AuditLogResponse;
import org.lite.snapshot.dto.AuditTrailEntry;
import org.lite.snapshot.scheduler.AuditArchivalScheduler;
import org.lite.snapshot.service.AuditArchivalService;
import org.lite.snapshot.service.AuditService;
import org.lite.snapshot.service.SnapshotService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Audit trail queries and archival management
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Snapshot Audit", description = "Audit trail of snapshot actions and archival")
public class AuditController {

    private final SnapshotService snapshotService;
    private final AuditService auditService;
    private final AuditArchivalService archivalService;
    private final AuditArchivalScheduler archivalScheduler;

    @GetMapping("/tenants/{tenantId}/audit")
    @Operation(summary = "Audit trail", description = "Entries newest first; defaults to the last 90 days")
    public Mono<ResponseEntity<List<AuditTrailEntry>>> listAuditTrail(
            @PathVariable String tenantId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return snapshotService.listAuditTrail(tenantId, from, to)
                .collectList()
                .map(ResponseEntity::ok);
    }

    @PostMapping("/tenants/{tenantId}/audit/query")
    @Operation(summary = "Query audit logs", description = "Filter by action, actor, result and version, with pagination")
    public Mono<ResponseEntity<AuditLogPageResponse>> queryAuditLogs(
            @PathVariable String tenantId,
            @RequestBody AuditLogQueryRequest request) {
        log.debug("Received audit log query for tenant {}: {}", tenantId, request);
        // the path decides the tenant
        request.setTenantId(tenantId);
        return auditService.queryPage(request)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/admin/audit/archive")
    @Operation(summary = "Trigger archival", description = "Moves entries past the retention window into monthly archive collections")
    public Mono<ResponseEntity<ArchivalResult>> triggerArchival() {
        return archivalScheduler.triggerArchival()
                .map(ResponseEntity::ok);
    }

    @GetMapping("/admin/audit/archive/{partitionKey}/tenants/{tenantId}")
    @Operation(summary = "Read archived entries", description = "Archived entries of one tenant in one yyyy-MM partition")
    public Mono<ResponseEntity<List<AuditLogResponse>>> queryArchived(
            @PathVariable String partitionKey,
            @PathVariable String tenantId) {
        return archivalService.queryArchived(tenantId, partitionKey)
                .map(AuditLogResponse::fromEntity)
                .collectList()
                .map(ResponseEntity::ok);
    }
}
