package com.helmet.corpus.model;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Input of one generator invocation: a single entry for per-paper stages, a pre-grouped
 * batch for evidence synthesis.
 */
public record WorkUnit(
    List<IndexEntry> entries,
    Map<UUID, PaperRecord> papers
) {

    public List<UUID> paperIds() {
        return entries.stream().map(IndexEntry::paperId).toList();
    }

    public IndexEntry single() {
        if (entries.size() != 1) {
            throw new IllegalStateException("Expected a single-paper unit but got " + entries.size() + " entries");
        }
        return entries.get(0);
    }

    public PaperRecord paper(UUID paperId) {
        return papers.get(paperId);
    }
}
