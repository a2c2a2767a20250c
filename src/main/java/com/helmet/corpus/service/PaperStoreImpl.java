package com.helmet.corpus.service;

import com.helmet.corpus.exception.ConflictException;
import com.helmet.corpus.exception.EntityNotFoundException;
import com.helmet.corpus.model.PaperRecord;
import com.helmet.corpus.repository.ArtifactRepository;
import com.helmet.corpus.repository.PaperRepository;
import com.helmet.corpus.util.StableIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class PaperStoreImpl implements PaperStore {

    private final PaperRepository paperRepository;
    private final ArtifactRepository artifactRepository;

    @Override
    @Transactional
    public PaperRecord put(String externalSourceId, String rawContent, boolean overwrite) {
        if (rawContent == null) {
            throw new IllegalArgumentException("rawContent cannot be null");
        }

        UUID paperId = StableIds.paperId(externalSourceId);
        String contentHash = StableIds.contentHash(rawContent);

        Optional<PaperRecord> existing = paperRepository.findById(paperId);
        if (existing.isEmpty()) {
            Optional<PaperRecord> inserted = paperRepository.insertIfAbsent(
                new PaperRecord(paperId, externalSourceId.trim(), rawContent, contentHash, null));
            if (inserted.isPresent()) {
                log.info("Stored paper {} as {}", externalSourceId.trim(), paperId);
                return inserted.get();
            }
            // a concurrent put won the insert
            existing = paperRepository.findById(paperId);
        }

        PaperRecord current = existing.orElseThrow(() -> new EntityNotFoundException(paperId));

        if (current.contentHash().equals(contentHash)) {
            log.debug("Paper {} unchanged, keeping stored record", paperId);
            return current;
        }

        if (!overwrite) {
            log.warn("Paper {} re-fetched with different content and overwrite disabled", paperId);
            throw new ConflictException(paperId, "Paper " + current.externalSourceId() + " already stored with different content");
        }

        log.info("Overwriting content of paper {}", paperId);
        return paperRepository.replaceContent(paperId, rawContent, contentHash);
    }

    @Override
    @Transactional(readOnly = true)
    public PaperRecord get(UUID paperId) {
        return paperRepository.findById(paperId)
            .orElseThrow(() -> {
                log.warn("Paper not found with ID: {}", paperId);
                return new EntityNotFoundException(paperId);
            });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PaperRecord> findByExternalSourceId(String externalSourceId) {
        if (externalSourceId == null || externalSourceId.isBlank()) {
            return Optional.empty();
        }
        return paperRepository.findByExternalSourceId(externalSourceId.trim());
    }

    @Override
    @Transactional
    public void purge(UUID paperId) {
        get(paperId);

        if (artifactRepository.isReferenced(paperId)) {
            throw new ConflictException(paperId, "Paper " + paperId + " is still referenced by generated artifacts");
        }

        paperRepository.delete(paperId);
        log.info("Purged paper {}", paperId);
    }
}
