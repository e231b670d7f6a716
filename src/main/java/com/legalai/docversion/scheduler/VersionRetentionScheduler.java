package com.legalai.docversion.scheduler;

import com.legalai.docversion.dto.CleanupResult;
import com.legalai.docversion.service.RetentionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic retention sweep. Runs daily by default; see versioning.retention.* properties.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "versioning.retention.enabled", havingValue = "true", matchIfMissing = true)
public class VersionRetentionScheduler {

    private final RetentionService retentionService;
    private final int retentionDays;

    public VersionRetentionScheduler(RetentionService retentionService,
                                     @Value("${versioning.retention.days:30}") int retentionDays) {
        this.retentionService = retentionService;
        this.retentionDays = retentionDays;
    }

    @Scheduled(cron = "${versioning.retention.cron:0 0 3 * * *}")
    public void sweepExpiredVersions() {
        log.debug("Running version retention sweep ({} days)...", retentionDays);
        try {
            CleanupResult result = retentionService.cleanupOldVersions(retentionDays);
            log.debug("Version retention sweep finished: {} versions, {} comparisons removed",
                    result.deletedVersions(), result.deletedComparisons());
        } catch (Exception e) {
            log.error("Version retention sweep failed: {}", e.getMessage(), e);
        }
    }
}
