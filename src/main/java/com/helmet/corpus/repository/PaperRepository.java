package com.helmet.corpus.repository;

import com.helmet.corpus.model.PaperRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PaperRepository {
    Optional<PaperRecord> insertIfAbsent(PaperRecord paper);
    Optional<PaperRecord> findById(UUID id);
    Optional<PaperRecord> findByExternalSourceId(String externalSourceId);
    List<PaperRecord> findAllById(Collection<UUID> ids);
    PaperRecord replaceContent(UUID id, String rawContent, String contentHash);
    void delete(UUID id);
}
