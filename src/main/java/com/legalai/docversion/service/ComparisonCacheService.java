package com.legalai.docversion.service;

import com.legalai.docversion.exception.ComparisonNotFoundException;
import com.legalai.docversion.exception.ComparisonTimeoutException;
import com.legalai.docversion.exception.DiffCancelledException;
import com.legalai.docversion.exception.VersionNotFoundException;
import com.legalai.docversion.model.DocumentComparison;
import com.legalai.docversion.model.DocumentVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Persistent cache of comparisons keyed by the ordered version pair.
 *
 * A hit is returned verbatim and never recomputed, even if either version's analysis
 * has changed since. A miss computes the comparison on the diff executor under the
 * configured timeout and persists it only once it completed.
 *
 * Concurrent misses for the same pair inside this process share one computation, and a
 * caller that takes over the slot after it was released re-reads the store first.
 * Two instances racing on the same pair can still both insert; lookups return the
 * oldest row so the visible id stays stable.
 */
@Service
@Slf4j
public class ComparisonCacheService {

    private final VersionStoreService versionStore;
    private final DocumentComparisonService comparisonService;
    private final ExecutorService diffExecutor;
    private final long timeoutSeconds;

    private final ConcurrentMap<String, CompletableFuture<DocumentComparison>> inFlight = new ConcurrentHashMap<>();

    public ComparisonCacheService(VersionStoreService versionStore,
                                  DocumentComparisonService comparisonService,
                                  @Qualifier("diffExecutor") ExecutorService diffExecutor,
                                  @Value("${versioning.diff.timeout-seconds:30}") long timeoutSeconds) {
        this.versionStore = versionStore;
        this.comparisonService = comparisonService;
        this.diffExecutor = diffExecutor;
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * Return the cached comparison for the ordered pair, computing and persisting it on first request.
     *
     * @throws VersionNotFoundException    if either version does not exist
     * @throws ComparisonTimeoutException  if the diff exceeds the configured timeout
     * @throws DiffCancelledException      if the calling thread is interrupted while waiting
     * @throws RejectedExecutionException  if the diff queue is full
     */
    public DocumentComparison compare(String originalVersionId, String comparedVersionId) {
        Optional<DocumentComparison> cached = versionStore.findComparison(originalVersionId, comparedVersionId);
        if (cached.isPresent()) {
            log.debug("Comparison cache hit for {} -> {}", originalVersionId, comparedVersionId);
            return cached.get();
        }

        String key = pairKey(originalVersionId, comparedVersionId);
        CompletableFuture<DocumentComparison> mine = new CompletableFuture<>();
        CompletableFuture<DocumentComparison> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("Joining in-flight comparison for {} -> {}", originalVersionId, comparedVersionId);
            return await(existing, null, originalVersionId, comparedVersionId);
        }

        try {
            // The previous owner may have stored it between our lookup and taking the slot
            Optional<DocumentComparison> stored = versionStore.findComparison(originalVersionId, comparedVersionId);
            DocumentComparison result = stored.isPresent()
                    ? stored.get()
                    : computeAndPersist(originalVersionId, comparedVersionId);
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    public DocumentComparison getComparison(String comparisonId) {
        return versionStore.getComparisonById(comparisonId)
                .orElseThrow(() -> new ComparisonNotFoundException("Comparison not found with id: " + comparisonId));
    }

    /**
     * All comparisons touching any version of the document, newest first.
     */
    public List<DocumentComparison> getComparisonsForDocument(String documentId) {
        List<String> versionIds = versionStore.getVersionsByDocumentId(documentId).stream()
                .map(DocumentVersion::getId)
                .toList();
        return versionStore.getComparisonsForVersions(versionIds);
    }

    private DocumentComparison computeAndPersist(String originalVersionId, String comparedVersionId) {
        DocumentVersion original = versionStore.getVersionById(originalVersionId)
                .orElseThrow(() -> VersionNotFoundException.forId(originalVersionId));
        DocumentVersion compared = versionStore.getVersionById(comparedVersionId)
                .orElseThrow(() -> VersionNotFoundException.forId(comparedVersionId));

        Future<DocumentComparison> task;
        try {
            task = diffExecutor.submit(() -> comparisonService.compareDocuments(original, compared));
        } catch (RejectedExecutionException e) {
            log.warn("Diff queue full, rejecting comparison {} -> {}", originalVersionId, comparedVersionId);
            throw e;
        }
        DocumentComparison comparison = await(task, task, originalVersionId, comparedVersionId);

        DocumentComparison saved = versionStore.saveComparison(comparison);
        log.info("Stored comparison {} for {} -> {} ({} changes, impact {})",
                saved.getId(), originalVersionId, comparedVersionId,
                saved.getChanges().size(), saved.getImpactAnalysis().getOverallImpact());
        return saved;
    }

    /**
     * Wait for a result under the timeout. {@code cancellable} is cancelled with interruption
     * when waiting fails; joiners pass null and leave the owner's task alone.
     */
    private DocumentComparison await(Future<DocumentComparison> future,
                                     Future<DocumentComparison> cancellable,
                                     String originalVersionId,
                                     String comparedVersionId) {
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            cancel(cancellable);
            throw new ComparisonTimeoutException("Comparison " + originalVersionId + " -> " + comparedVersionId
                    + " did not finish within " + timeoutSeconds + "s");
        } catch (InterruptedException e) {
            cancel(cancellable);
            Thread.currentThread().interrupt();
            throw new DiffCancelledException("Comparison " + originalVersionId + " -> " + comparedVersionId
                    + " was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Comparison failed: " + cause.getMessage(), cause);
        }
    }

    private void cancel(Future<?> future) {
        if (future == null) {
            return;
        }
        future.cancel(true);
        // Free the queue slot of a task that never started
        if (diffExecutor instanceof ThreadPoolExecutor pool && future instanceof Runnable queued) {
            pool.remove(queued);
        }
    }

    private static String pairKey(String originalVersionId, String comparedVersionId) {
        return originalVersionId + "->" + comparedVersionId;
    }
}
