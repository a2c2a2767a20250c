package com.helmet.corpus.service;

import com.helmet.corpus.model.PaperRecord;

import java.util.Optional;
import java.util.UUID;

public interface PaperStore {
    PaperRecord put(String externalSourceId, String rawContent, boolean overwrite);
    PaperRecord get(UUID paperId);
    Optional<PaperRecord> findByExternalSourceId(String externalSourceId);
    void purge(UUID paperId);
}
