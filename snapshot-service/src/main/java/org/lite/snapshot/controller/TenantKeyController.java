package org.lite.snapshot.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.lite.snapshot.dto.ActiveKeyResponse;
import org.lite.snapshot.dto.KeyRotationResponse;
import org.lite.snapshot.dto.ReencryptionResponse;
import org.lite.snapshot.service.SnapshotService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/tenants/{tenantId}/keys")
@RequiredArgsConstructor
@Tag(name = "Tenant Keys", description = "Key version management. Key material is never exposed.")
public class TenantKeyController {

    private final SnapshotService snapshotService;

    @GetMapping("/active")
    @Operation(summary = "Active key version")
    public Mono<ResponseEntity<ActiveKeyResponse>> getActiveKeyVersion(@PathVariable String tenantId) {
        return snapshotService.getActiveKeyVersion(tenantId)
                .map(version -> ResponseEntity.ok(ActiveKeyResponse.builder()
                        .tenantId(tenantId)
                        .keyVersion(version)
                        .build()));
    }

    @PostMapping("/rotate")
    @Operation(summary = "Rotate key", description = "New snapshots use the next key version; old ones stay readable. "
            + "Other instances pick up the new version within bia.snapshot.key-version-cache-ttl (default 10s) "
            + "and keep encrypting under the previous version until then.")
    public Mono<ResponseEntity<KeyRotationResponse>> rotateKey(
            @PathVariable String tenantId,
            @RequestHeader(value = SnapshotController.ACTOR_HEADER, required = false) String actorId) {
        return snapshotService.rotateKey(tenantId, actorId)
                .map(ResponseEntity::ok);
    }

    @PostMapping("/reencrypt")
    @Operation(summary = "Re-encrypt history", description = "Re-saves snapshots under older key versions as new versions")
    public Mono<ResponseEntity<ReencryptionResponse>> reencrypt(
            @PathVariable String tenantId,
            @RequestHeader(value = SnapshotController.ACTOR_HEADER, required = false) String actorId) {
        return snapshotService.reencrypt(tenantId, actorId)
                .map(ResponseEntity::ok);
    }
}
