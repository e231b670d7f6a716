package com.legalai.docversion.service;

import com.legalai.docversion.model.DocumentVersion;
import com.legalai.docversion.model.VersionCounter;
import com.legalai.docversion.repository.DocumentVersionRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VersionNumberAllocatorTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private DocumentVersionRepository versionRepository;

    @InjectMocks
    private VersionNumberAllocator allocator;

    @Test
    void allocate_returnsIncrementedCounter() {
        when(mongoTemplate.exists(any(Query.class), eq(VersionCounter.class))).thenReturn(true);
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class),
                eq(VersionCounter.class))).thenReturn(new VersionCounter("doc-1", 4));

        assertThat(allocator.allocate("doc-1")).isEqualTo(4);
        verify(mongoTemplate, never()).insert(any(VersionCounter.class));
    }

    @Test
    void allocate_incrementsSeqAtomicallyWithUpsert() {
        when(mongoTemplate.exists(any(Query.class), eq(VersionCounter.class))).thenReturn(false);
        when(versionRepository.findTopByDocumentIdOrderByVersionNumberDesc("doc-1")).thenReturn(Optional.empty());
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class),
                eq(VersionCounter.class))).thenReturn(new VersionCounter("doc-1", 1));

        assertThat(allocator.allocate("doc-1")).isEqualTo(1);

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        ArgumentCaptor<FindAndModifyOptions> options = ArgumentCaptor.forClass(FindAndModifyOptions.class);
        verify(mongoTemplate).findAndModify(any(Query.class), update.capture(), options.capture(),
                eq(VersionCounter.class));
        assertThat(update.getValue().getUpdateObject().toJson()).contains("$inc").contains("seq");
        assertThat(options.getValue().isUpsert()).isTrue();
        assertThat(options.getValue().isReturnNew()).isTrue();
        verify(mongoTemplate, never()).insert(any(VersionCounter.class));
    }

    @Test
    void allocate_seedsCounterFromExistingVersions() {
        when(mongoTemplate.exists(any(Query.class), eq(VersionCounter.class))).thenReturn(false);
        when(versionRepository.findTopByDocumentIdOrderByVersionNumberDesc("doc-1"))
                .thenReturn(Optional.of(DocumentVersion.builder().id("v3").documentId("doc-1").versionNumber(3).build()));
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class),
                eq(VersionCounter.class))).thenReturn(new VersionCounter("doc-1", 4));

        assertThat(allocator.allocate("doc-1")).isEqualTo(4);

        ArgumentCaptor<VersionCounter> seeded = ArgumentCaptor.forClass(VersionCounter.class);
        verify(mongoTemplate).insert(seeded.capture());
        assertThat(seeded.getValue().getDocumentId()).isEqualTo("doc-1");
        assertThat(seeded.getValue().getSeq()).isEqualTo(3);
    }

    @Test
    void allocate_toleratesConcurrentSeeding() {
        when(mongoTemplate.exists(any(Query.class), eq(VersionCounter.class))).thenReturn(false);
        when(versionRepository.findTopByDocumentIdOrderByVersionNumberDesc("doc-1"))
                .thenReturn(Optional.of(DocumentVersion.builder().id("v3").documentId("doc-1").versionNumber(3).build()));
        when(mongoTemplate.insert(any(VersionCounter.class))).thenThrow(new DuplicateKeyException("dup"));
        when(mongoTemplate.findAndModify(any(Query.class), any(Update.class), any(FindAndModifyOptions.class),
                eq(VersionCounter.class))).thenReturn(new VersionCounter("doc-1", 5));

        assertThat(allocator.allocate("doc-1")).isEqualTo(5);
    }

    @Test
    void peekNext_readsCounterWithoutIncrementing() {
        when(mongoTemplate.findOne(any(Query.class), eq(VersionCounter.class))).thenReturn(new VersionCounter("doc-1", 7));

        assertThat(allocator.peekNext("doc-1")).isEqualTo(8);
        verify(mongoTemplate, never()).findAndModify(any(Query.class), any(Update.class),
                any(FindAndModifyOptions.class), eq(VersionCounter.class));
    }

    @Test
    void peekNext_withoutCounter_usesHighestVersion() {
        when(mongoTemplate.findOne(any(Query.class), eq(VersionCounter.class))).thenReturn(null);
        when(versionRepository.findTopByDocumentIdOrderByVersionNumberDesc("doc-9")).thenReturn(Optional.empty());

        assertThat(allocator.peekNext("doc-9")).isEqualTo(1);
    }
}
