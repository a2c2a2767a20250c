package com.helmet.corpus.service;

import com.helmet.corpus.config.PipelineProperties;
import com.helmet.corpus.exception.EntityNotFoundException;
import com.helmet.corpus.exception.ExtractionException;
import com.helmet.corpus.extraction.PaperMetadataExtractor;
import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.LedgerEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.PaperMetadata;
import com.helmet.corpus.model.PaperRecord;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.repository.IndexEntryRepository;
import com.helmet.corpus.repository.LedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

@Service
@Slf4j
@RequiredArgsConstructor
public class IndexCatalogImpl implements IndexCatalog {

    private static final Set<LedgerStatus> NOT_DONE = EnumSet.of(LedgerStatus.PENDING, LedgerStatus.RUNNING, LedgerStatus.FAILED);

    private final IndexEntryRepository indexEntryRepository;
    private final LedgerRepository ledgerRepository;
    private final PaperMetadataExtractor defaultExtractor;
    private final PipelineProperties pipelineProperties;

    @Override
    @Transactional
    public IndexEntry index(PaperRecord paper, PaperMetadataExtractor extractor) {
        PaperMetadata metadata;
        String failure = null;

        try {
            metadata = extractor.extract(paper.rawContent());
        } catch (ExtractionException e) {
            log.warn("Paper {}: metadata extraction failed, indexing partial metadata: {}", paper.id(), e.getMessage());
            metadata = e.getPartialMetadata() != null ? e.getPartialMetadata() : PaperMetadata.empty();
            failure = e.getMessage();
        }

        indexEntryRepository.upsert(paper.id(), metadata);
        ledgerRepository.seed(paper.id(), Stage.generationStages());
        ledgerRepository.mark(paper.id(), Stage.INDEXING, failure == null ? LedgerStatus.DONE : LedgerStatus.FAILED, failure);

        log.debug("Indexed paper {} ({})", paper.id(), paper.externalSourceId());
        return get(paper.id());
    }

    @Override
    @Transactional
    public IndexEntry index(PaperRecord paper) {
        return index(paper, defaultExtractor);
    }

    @Override
    public void mark(UUID paperId, Stage stage, LedgerStatus status) {
        mark(paperId, stage, status, null);
    }

    @Override
    @Transactional
    public void mark(UUID paperId, Stage stage, LedgerStatus status, String error) {
        if (!indexEntryRepository.existsById(paperId)) {
            throw new EntityNotFoundException(paperId);
        }
        ledgerRepository.mark(paperId, stage, status, error);
    }

    @Override
    public Stream<IndexEntry> pendingFor(Stage stage) {
        return entriesFor(stage, NOT_DONE);
    }

    @Override
    public Stream<IndexEntry> entriesFor(Stage stage, Collection<LedgerStatus> statuses) {
        Set<LedgerStatus> wanted = statuses.isEmpty() ? EnumSet.noneOf(LedgerStatus.class) : EnumSet.copyOf(statuses);
        Iterator<IndexEntry> iterator = new KeysetIterator(stage, wanted, pipelineProperties.pageSize());
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    @Transactional(readOnly = true)
    public IndexEntry get(UUID paperId) {
        return indexEntryRepository.findById(paperId)
            .orElseThrow(() -> new EntityNotFoundException(paperId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntry> ledger(UUID paperId) {
        if (!indexEntryRepository.existsById(paperId)) {
            throw new EntityNotFoundException(paperId);
        }
        return ledgerRepository.findByPaperId(paperId);
    }

    /**
     * Pages through the catalog by insertion sequence, fetching the next page only when the
     * current one is used up.
     */
    private final class KeysetIterator implements Iterator<IndexEntry> {

        private final Stage stage;
        private final Set<LedgerStatus> statuses;
        private final int pageSize;

        private Iterator<IndexEntry> page = Collections.emptyIterator();
        private long cursor = 0;
        private boolean exhausted;

        private KeysetIterator(Stage stage, Set<LedgerStatus> statuses, int pageSize) {
            this.stage = stage;
            this.statuses = statuses;
            this.pageSize = pageSize;
        }

        @Override
        public boolean hasNext() {
            if (!page.hasNext() && !exhausted) {
                List<IndexEntry> next = indexEntryRepository.findPage(stage, statuses, cursor, pageSize);
                exhausted = next.size() < pageSize;
                if (!next.isEmpty()) {
                    cursor = next.get(next.size() - 1).insertionSeq();
                }
                page = next.iterator();
            }
            return page.hasNext();
        }

        @Override
        public IndexEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.next();
        }
    }
}
