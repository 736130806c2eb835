package org.lite.snapshot.controller;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.dto.ApprovalRequest;
import org.lite.snapshot.dto.ApprovalStatusResponse;
import org.lite.snapshot.dto.RollbackRequest;
import org.lite.snapshot.dto.SnapshotPage;
import org.lite.snapshot.dto.SnapshotSaveRequest;
import org.lite.snapshot.dto.SnapshotSaveResponse;
import org.lite.snapshot.service.SnapshotService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Slf4j
@RestController
@RequestMapping("/api/v1/tenants/{tenantId}")
@RequiredArgsConstructor
@Tag(name = "BIA Snapshots", description = "Encrypted, versioned BIA datasets of a tenant")
public class SnapshotController {

    public static final String ACTOR_HEADER = "X-Actor-Id";

    private final SnapshotService snapshotService;

    @PostMapping("/snapshots")
    @Operation(summary = "Save snapshot", description = "Encrypts the dataset and stores it as the next version")
    public Mono<ResponseEntity<SnapshotSaveResponse>> saveSnapshot(
            @PathVariable String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody SnapshotSaveRequest request) {
        log.debug("Save request for tenant {} by {}", tenantId, actorId);
        return snapshotService.saveSnapshot(tenantId, request.getData(), actorId, request.getSource(),
                        request.getNotes())
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @GetMapping("/snapshots/latest")
    @Operation(summary = "Get latest snapshot", description = "Decrypts the newest version; never served from cache")
    public Mono<ResponseEntity<JsonNode>> getLatestSnapshot(
            @PathVariable String tenantId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId) {
        return snapshotService.getLatestSnapshot(tenantId, actorId)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/snapshots/{version}")
    @Operation(summary = "Get snapshot version")
    public Mono<ResponseEntity<JsonNode>> getSnapshotVersion(
            @PathVariable String tenantId,
            @PathVariable int version,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId) {
        return snapshotService.getSnapshotVersion(tenantId, version, actorId)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/snapshots")
    @Operation(summary = "List versions", description = "Version metadata, newest first. Pass nextCursor as cursor for the next page.")
    public Mono<ResponseEntity<SnapshotPage>> listVersions(
            @PathVariable String tenantId,
            @RequestParam(required = false) Integer from,
            @RequestParam(required = false) Integer to,
            @RequestParam(required = false) Integer cursor,
            @RequestParam(required = false) Integer limit) {
        return snapshotService.listVersions(tenantId, from, to, cursor, limit)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/snapshots/{version}/rollback")
    @Operation(summary = "Roll back", description = "Re-saves an older version as the newest version")
    public Mono<ResponseEntity<SnapshotSaveResponse>> rollbackToVersion(
            @PathVariable String tenantId,
            @PathVariable int version,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody(required = false) RollbackRequest request) {
        String notes = request != null ? request.getNotes() : null;
        return snapshotService.rollbackToVersion(tenantId, version, actorId, notes)
                .map(response -> ResponseEntity.status(HttpStatus.CREATED).body(response));
    }

    @PostMapping("/snapshots/{version}/approve")
    @Operation(summary = "Approve snapshot version")
    public Mono<ResponseEntity<ApprovalStatusResponse>> approveSnapshot(
            @PathVariable String tenantId,
            @PathVariable int version,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody(required = false) ApprovalRequest request) {
        return snapshotService.approveSnapshot(tenantId, version, actorId, request != null ? request.getComment() : null)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/snapshots/{version}/reject")
    @Operation(summary = "Reject snapshot version")
    public Mono<ResponseEntity<ApprovalStatusResponse>> rejectSnapshot(
            @PathVariable String tenantId,
            @PathVariable int version,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @Valid @RequestBody(required = false) ApprovalRequest request) {
        return snapshotService.rejectSnapshot(tenantId, version, actorId, request != null ? request.getComment() : null)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/snapshots/{version}/approval")
    @Operation(summary = "Get approval status")
    public Mono<ResponseEntity<ApprovalStatusResponse>> getApprovalStatus(
            @PathVariable String tenantId,
            @PathVariable int version) {
        return snapshotService.getApprovalStatus(tenantId, version)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/views/{viewName}")
    @Operation(summary = "Get derived view", description = "Cached view of the latest snapshot (summary, history)")
    public Mono<ResponseEntity<JsonNode>> getCachedView(
            @PathVariable String tenantId,
            @PathVariable String viewName) {
        return snapshotService.getCachedView(tenantId, viewName)
                .map(ResponseEntity::ok);
    }
}
