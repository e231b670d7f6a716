package com.legalai.docversion.service;

import com.legalai.docversion.dto.CleanupResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Deletes versions and comparisons older than a retention window, together with any
 * comparison that references a deleted version.
 * Holds no lock, so version creation proceeds while a sweep runs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RetentionService {

    static final int MAX_RETENTION_DAYS = 365;

    private final VersionStoreService versionStore;
    private final Clock clock;

    public CleanupResult cleanupOldVersions(int retentionDays) {
        if (retentionDays < 1 || retentionDays > MAX_RETENTION_DAYS) {
            throw new IllegalArgumentException(
                    "retentionDays must be between 1 and " + MAX_RETENTION_DAYS + ", was " + retentionDays);
        }

        Instant cutoff = Instant.now(clock).minus(Duration.ofDays(retentionDays));
        List<String> expiredVersionIds = versionStore.findVersionIdsOlderThan(cutoff);
        long deletedVersions = versionStore.deleteVersionsOlderThan(cutoff);
        // Comparisons of removed versions go with them, however recent
        long deletedComparisons = versionStore.deleteComparisonsForVersions(expiredVersionIds)
                + versionStore.deleteComparisonsOlderThan(cutoff);

        if (deletedVersions > 0 || deletedComparisons > 0) {
            log.info("Retention sweep removed {} versions and {} comparisons older than {}",
                    deletedVersions, deletedComparisons, cutoff);
        }
        return new CleanupResult(deletedVersions, deletedComparisons, cutoff);
    }
}
