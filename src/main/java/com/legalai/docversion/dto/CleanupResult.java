package com.legalai.docversion.dto;

import java.time.Instant;

public record CleanupResult(long deletedVersions, long deletedComparisons, Instant cutoffDate) {
}
