package com.helmet.corpus.service;

import com.helmet.corpus.extraction.PaperMetadataExtractor;
import com.helmet.corpus.model.IndexEntry;
import com.helmet.corpus.model.LedgerEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.PaperRecord;
import com.helmet.corpus.model.Stage;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

public interface IndexCatalog {

    IndexEntry index(PaperRecord paper, PaperMetadataExtractor extractor);

    /**
     * Indexes with the application's default extractor.
     */
    IndexEntry index(PaperRecord paper);

    void mark(UUID paperId, Stage stage, LedgerStatus status);
    void mark(UUID paperId, Stage stage, LedgerStatus status, String error);

    /**
     * Entries whose status for {@code stage} is anything but DONE, in index-insertion order.
     * The stream is lazy and reads the ledger as it goes; every call starts a fresh scan.
     */
    Stream<IndexEntry> pendingFor(Stage stage);

    /**
     * Same scan as {@link #pendingFor(Stage)} for an arbitrary set of statuses.
     */
    Stream<IndexEntry> entriesFor(Stage stage, Collection<LedgerStatus> statuses);

    IndexEntry get(UUID paperId);
    List<LedgerEntry> ledger(UUID paperId);
}
