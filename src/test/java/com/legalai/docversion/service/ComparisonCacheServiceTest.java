package com.legalai.docversion.service;

import com.legalai.docversion.exception.ComparisonNotFoundException;
import com.legalai.docversion.exception.ComparisonTimeoutException;
import com.legalai.docversion.exception.DiffCancelledException;
import com.legalai.docversion.exception.NotFoundException;
import com.legalai.docversion.model.DocumentComparison;
import com.legalai.docversion.model.DocumentVersion;
import com.legalai.docversion.model.Impact;
import com.legalai.docversion.model.ImpactAnalysis;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComparisonCacheServiceTest {

    @Mock
    private VersionStoreService versionStore;

    @Mock
    private DocumentComparisonService comparisonService;

    private ExecutorService diffExecutor;
    private ComparisonCacheService cache;

    private final DocumentVersion v1 = DocumentVersion.builder().id("v1").documentId("doc-1").versionNumber(1).build();
    private final DocumentVersion v2 = DocumentVersion.builder().id("v2").documentId("doc-1").versionNumber(2).build();

    @BeforeEach
    void setUp() {
        diffExecutor = Executors.newFixedThreadPool(2);
        cache = new ComparisonCacheService(versionStore, comparisonService, diffExecutor, 2);
    }

    @AfterEach
    void tearDown() {
        diffExecutor.shutdownNow();
    }

    @Test
    void cacheHit_returnsStoredComparisonWithoutRecomputing() {
        DocumentComparison stored = comparison("cmp-1", "v1", "v2");
        when(versionStore.findComparison("v1", "v2")).thenReturn(Optional.of(stored));

        DocumentComparison result = cache.compare("v1", "v2");

        assertThat(result).isSameAs(stored);
        verify(versionStore, never()).getVersionById(any());
        verify(comparisonService, never()).compareDocuments(any(), any());
        verify(versionStore, never()).saveComparison(any());
    }

    @Test
    void cacheMiss_computesAndPersists() {
        DocumentComparison computed = comparison("cmp-1", "v1", "v2");
        when(versionStore.findComparison("v1", "v2")).thenReturn(Optional.empty());
        when(versionStore.getVersionById("v1")).thenReturn(Optional.of(v1));
        when(versionStore.getVersionById("v2")).thenReturn(Optional.of(v2));
        when(comparisonService.compareDocuments(v1, v2)).thenReturn(computed);
        when(versionStore.saveComparison(computed)).thenReturn(computed);

        DocumentComparison result = cache.compare("v1", "v2");

        assertThat(result.getId()).isEqualTo("cmp-1");
        verify(versionStore).saveComparison(computed);
    }

    @Test
    void missingVersion_failsWithNotFound() {
        when(versionStore.findComparison("v1", "missing")).thenReturn(Optional.empty());
        when(versionStore.getVersionById("v1")).thenReturn(Optional.of(v1));
        when(versionStore.getVersionById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> cache.compare("v1", "missing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("missing");
        verify(comparisonService, never()).compareDocuments(any(), any());
        verify(versionStore, never()).saveComparison(any());
    }

    @Test
    void slowDiff_timesOutWithoutPersisting() {
        CountDownLatch neverReleased = new CountDownLatch(1);
        when(versionStore.findComparison("v1", "v2")).thenReturn(Optional.empty());
        when(versionStore.getVersionById("v1")).thenReturn(Optional.of(v1));
        when(versionStore.getVersionById("v2")).thenReturn(Optional.of(v2));
        when(comparisonService.compareDocuments(v1, v2)).thenAnswer(invocation -> {
            neverReleased.await();
            return comparison("late", "v1", "v2");
        });

        ComparisonCacheService shortTimeout = new ComparisonCacheService(versionStore, comparisonService, diffExecutor, 1);

        assertThatThrownBy(() -> shortTimeout.compare("v1", "v2"))
                .isInstanceOf(ComparisonTimeoutException.class);
        verify(versionStore, never()).saveComparison(any());
    }

    @Test
    void concurrentFirstRequests_shareOneComputation() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DocumentComparison computed = comparison("cmp-1", "v1", "v2");

        when(versionStore.findComparison("v1", "v2")).thenReturn(Optional.empty());
        when(versionStore.getVersionById("v1")).thenReturn(Optional.of(v1));
        when(versionStore.getVersionById("v2")).thenReturn(Optional.of(v2));
        when(comparisonService.compareDocuments(v1, v2)).thenAnswer(invocation -> {
            started.countDown();
            release.await();
            return computed;
        });
        when(versionStore.saveComparison(computed)).thenReturn(computed);

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<DocumentComparison> first = callers.submit(() -> cache.compare("v1", "v2"));
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
            Future<DocumentComparison> second = callers.submit(() -> cache.compare("v1", "v2"));

            Thread.sleep(200);
            release.countDown();

            assertThat(first.get(2, TimeUnit.SECONDS).getId()).isEqualTo("cmp-1");
            assertThat(second.get(2, TimeUnit.SECONDS).getId()).isEqualTo("cmp-1");
        } finally {
            callers.shutdownNow();
        }

        verify(comparisonService, times(1)).compareDocuments(v1, v2);
        verify(versionStore, times(1)).saveComparison(computed);
    }

    @Test
    void slotTakenAfterPreviousOwnerFinished_reusesStoredComparison() {
        DocumentComparison stored = comparison("cmp-1", "v1", "v2");
        when(versionStore.findComparison("v1", "v2")).thenReturn(Optional.empty(), Optional.of(stored));

        DocumentComparison result = cache.compare("v1", "v2");

        assertThat(result).isSameAs(stored);
        verify(versionStore, never()).getVersionById(any());
        verify(comparisonService, never()).compareDocuments(any(), any());
        verify(versionStore, never()).saveComparison(any());
    }

    @Test
    void interruptedCaller_cancelsDiffWithoutPersisting() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch diffInterrupted = new CountDownLatch(1);
        when(versionStore.findComparison("v1", "v2")).thenReturn(Optional.empty());
        when(versionStore.getVersionById("v1")).thenReturn(Optional.of(v1));
        when(versionStore.getVersionById("v2")).thenReturn(Optional.of(v2));
        when(comparisonService.compareDocuments(v1, v2)).thenAnswer(invocation -> {
            started.countDown();
            try {
                new CountDownLatch(1).await();
            } catch (InterruptedException e) {
                diffInterrupted.countDown();
                throw e;
            }
            return comparison("late", "v1", "v2");
        });

        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean interruptFlag = new AtomicBoolean();
        Thread caller = new Thread(() -> {
            try {
                cache.compare("v1", "v2");
            } catch (RuntimeException e) {
                thrown.set(e);
                interruptFlag.set(Thread.currentThread().isInterrupted());
            }
        });
        caller.start();
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(2000);

        assertThat(thrown.get()).isInstanceOf(DiffCancelledException.class);
        assertThat(interruptFlag.get()).isTrue();
        assertThat(diffInterrupted.await(2, TimeUnit.SECONDS)).isTrue();
        verify(versionStore, never()).saveComparison(any());
    }

    @Test
    void joiningCaller_receivesOwnersFailure() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(versionStore.findComparison("v1", "v2")).thenReturn(Optional.empty());
        when(versionStore.getVersionById("v1")).thenReturn(Optional.of(v1));
        when(versionStore.getVersionById("v2")).thenReturn(Optional.of(v2));
        when(comparisonService.compareDocuments(v1, v2)).thenAnswer(invocation -> {
            started.countDown();
            release.await();
            throw new IllegalStateException("segmentation failed");
        });

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<DocumentComparison> owner = callers.submit(() -> cache.compare("v1", "v2"));
            assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
            Future<DocumentComparison> joiner = callers.submit(() -> cache.compare("v1", "v2"));

            Thread.sleep(200);
            release.countDown();

            assertThatThrownBy(() -> owner.get(2, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> joiner.get(2, TimeUnit.SECONDS))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        } finally {
            callers.shutdownNow();
        }
        verify(versionStore, never()).saveComparison(any());
    }

    @Test
    void fullDiffQueue_rejectsWithoutPersisting() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ThreadPoolExecutor saturated = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(1), new ThreadPoolExecutor.AbortPolicy());
        try {
            // One running, one queued
            saturated.submit(() -> {
                release.await();
                return null;
            });
            saturated.submit(() -> {
                release.await();
                return null;
            });
            when(versionStore.findComparison("v1", "v2")).thenReturn(Optional.empty());
            when(versionStore.getVersionById("v1")).thenReturn(Optional.of(v1));
            when(versionStore.getVersionById("v2")).thenReturn(Optional.of(v2));
            ComparisonCacheService busy = new ComparisonCacheService(versionStore, comparisonService, saturated, 2);

            assertThatThrownBy(() -> busy.compare("v1", "v2"))
                    .isInstanceOf(RejectedExecutionException.class);
            verify(comparisonService, never()).compareDocuments(any(), any());
            verify(versionStore, never()).saveComparison(any());
        } finally {
            release.countDown();
            saturated.shutdownNow();
        }
    }

    @Test
    void getComparison_failsWhenUnknown() {
        when(versionStore.getComparisonById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> cache.getComparison("nope"))
                .isInstanceOf(ComparisonNotFoundException.class);
    }

    @Test
    void comparisonsForDocument_coverAllItsVersions() {
        DocumentComparison stored = comparison("cmp-1", "v1", "v2");
        when(versionStore.getVersionsByDocumentId("doc-1")).thenReturn(List.of(v1, v2));
        when(versionStore.getComparisonsForVersions(List.of("v1", "v2"))).thenReturn(List.of(stored));

        assertThat(cache.getComparisonsForDocument("doc-1")).containsExactly(stored);
    }

    private DocumentComparison comparison(String id, String originalId, String comparedId) {
        return DocumentComparison.builder()
                .id(id)
                .originalVersionId(originalId)
                .comparedVersionId(comparedId)
                .comparedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .changes(List.of())
                .impactAnalysis(ImpactAnalysis.builder()
                        .overallImpact(Impact.NEUTRAL)
                        .summary("Found 0 changes between document versions.")
                        .build())
                .build();
    }
}
