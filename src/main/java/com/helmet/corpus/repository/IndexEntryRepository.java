package com.helmet.corpus.repository;

import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.PaperMetadata;
import com.helmet.corpus.model.Stage;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface IndexEntryRepository {
    void upsert(UUID paperId, PaperMetadata metadata);
    Optional<IndexEntry> findById(UUID paperId);
    boolean existsById(UUID paperId);

    /**
     * One keyset page of entries, in insertion order, whose ledger status for {@code stage}
     * is one of {@code statuses}. A missing ledger row counts as {@link LedgerStatus#PENDING}.
     */
    List<IndexEntry> findPage(Stage stage, Collection<LedgerStatus> statuses, long afterSeq, int limit);
}
