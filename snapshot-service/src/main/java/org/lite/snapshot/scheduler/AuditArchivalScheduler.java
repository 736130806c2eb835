package org.lite.snapshot.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.snapshot.config.SnapshotProperties;
import org.lite.snapshot.dto.ArchivalResult;
import org.lite.snapshot.service.AuditArchivalService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Archives audit entries older than the retention window.
 * Runs daily at 2:00 AM.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditArchivalScheduler {

    private final AuditArchivalService auditArchivalService;
    private final SnapshotProperties properties;

    @Scheduled(cron = "${bia.snapshot.audit.archival-cron:0 0 2 * * ?}")
    public void archiveOldAuditLogs() {
        int retentionDays = properties.getAudit().getRetentionDays();
        log.info("Starting scheduled audit archival (retention: {} days)", retentionDays);

        auditArchivalService.archiveOldLogs(retentionDays)
                .subscribe(
                        result -> log.info("Scheduled audit archival completed, {} entries moved",
                                result.getArchivedCount()),
                        error -> log.error("Scheduled audit archival failed: {}", error.getMessage(), error));
    }

    /**
     * Manual trigger, exposed through the admin API
     */
    public Mono<ArchivalResult> triggerArchival() {
        int retentionDays = properties.getAudit().getRetentionDays();
        log.info("Manual audit archival triggered (retention: {} days)", retentionDays);
        return auditArchivalService.archiveOldLogs(retentionDays);
    }
}
