package com.helmet.corpus.generator;

import com.helmet.corpus.model.IndexEntry;

import java.util.List;

/**
 * Decides which papers are synthesised together. Must be a partition: every entry appears in
 * exactly one batch, and entries keep their relative order inside a batch.
 */
@FunctionalInterface
public interface SynthesisBatchPolicy {

    List<List<IndexEntry>> partition(List<IndexEntry> entries);
}
