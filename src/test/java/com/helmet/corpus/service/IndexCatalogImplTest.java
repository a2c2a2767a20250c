package com.helmet.corpus.service;

import com.helmet.corpus.PaperFixtures;
import com.helmet.corpus.exception.EntityNotFoundException;
import com.helmet.corpus.exception.ExtractionException;
import com.helmet.corpus.extraction.PaperMetadataExtractor;
import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.PaperMetadata;
import com.helmet.corpus.model.PaperRecord;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.repository.IndexEntryRepository;
import com.helmet.corpus.repository.LedgerRepository;
import com.helmet.corpus.util.StableIds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IndexCatalogImplTest {

    @Mock
    private IndexEntryRepository indexEntryRepository;

    @Mock
    private LedgerRepository ledgerRepository;

    @Mock
    private PaperMetadataExtractor extractor;

    private IndexCatalogImpl catalog;

    private final UUID paperId = StableIds.paperId("PMC1");
    private final PaperRecord paper = new PaperRecord(paperId, "PMC1", "{}", StableIds.contentHash("{}"), OffsetDateTime.now());

    @BeforeEach
    void setUp() {
        catalog = new IndexCatalogImpl(indexEntryRepository, ledgerRepository, extractor, PaperFixtures.pipelineProperties(2));
    }

    @Test
    @DisplayName("Successful extraction upserts the entry, seeds stages and marks indexing DONE")
    void shouldIndexPaper() {
        PaperMetadata metadata = new PaperMetadata("Title", "Abstract", Map.of("type", "cea"));
        IndexEntry entry = PaperFixtures.entry(paperId, 1, "Abstract", Map.of("type", "cea"));
        when(extractor.extract("{}")).thenReturn(metadata);
        when(indexEntryRepository.findById(paperId)).thenReturn(Optional.of(entry));

        assertThat(catalog.index(paper)).isEqualTo(entry);

        verify(indexEntryRepository).upsert(paperId, metadata);
        verify(ledgerRepository).seed(paperId, Stage.generationStages());
        verify(ledgerRepository).mark(paperId, Stage.INDEXING, LedgerStatus.DONE, null);
    }

    @Test
    @DisplayName("Extraction failure indexes partial metadata and marks indexing FAILED")
    void shouldRecordExtractionFailure() {
        PaperMetadata partial = new PaperMetadata(null, "Abstract", Map.of());
        when(extractor.extract("{}")).thenThrow(new ExtractionException("Required field 'title' is missing", partial));
        when(indexEntryRepository.findById(paperId)).thenReturn(Optional.of(PaperFixtures.entry(paperId, 1, "Abstract", Map.of())));

        catalog.index(paper);

        verify(indexEntryRepository).upsert(paperId, partial);
        verify(ledgerRepository).mark(paperId, Stage.INDEXING, LedgerStatus.FAILED, "Required field 'title' is missing");
    }

    @Test
    @DisplayName("Marking an unknown paper is rejected")
    void shouldRejectMarkForUnknownPaper() {
        when(indexEntryRepository.existsById(paperId)).thenReturn(false);

        assertThatThrownBy(() -> catalog.mark(paperId, Stage.LABELING, LedgerStatus.DONE))
            .isInstanceOf(EntityNotFoundException.class);
        verifyNoInteractions(ledgerRepository);
    }

    @Test
    @DisplayName("Pending scan pages lazily by insertion sequence")
    void shouldPageThroughPendingEntries() {
        IndexEntry first = PaperFixtures.entry(UUID.randomUUID(), 1, "A", Map.of());
        IndexEntry second = PaperFixtures.entry(UUID.randomUUID(), 4, "B", Map.of());
        IndexEntry third = PaperFixtures.entry(UUID.randomUUID(), 7, "C", Map.of());
        EnumSet<LedgerStatus> notDone = EnumSet.of(LedgerStatus.PENDING, LedgerStatus.RUNNING, LedgerStatus.FAILED);

        when(indexEntryRepository.findPage(Stage.EXTRACTION_QUERY, notDone, 0L, 2)).thenReturn(List.of(first, second));
        when(indexEntryRepository.findPage(Stage.EXTRACTION_QUERY, notDone, 4L, 2)).thenReturn(List.of(third));

        assertThat(catalog.pendingFor(Stage.EXTRACTION_QUERY)).containsExactly(first, second, third);
    }

    @Test
    @DisplayName("Nothing is read until the stream is consumed")
    void shouldNotQueryUntilConsumed() {
        catalog.pendingFor(Stage.LABELING);

        verifyNoInteractions(indexEntryRepository);
    }
}
