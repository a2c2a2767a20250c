package com.helmet.corpus.service;

import com.helmet.corpus.model.ArtifactRecord;
import com.helmet.corpus.model.LedgerEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.repository.ArtifactRepository;
import com.helmet.corpus.repository.LedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Terminal ledger transitions of a work unit. Every method is one transaction, so a unit's
 * artifacts and its DONE marks are visible together or not at all.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ArtifactCommitService {

    private final ArtifactRepository artifactRepository;
    private final LedgerRepository ledgerRepository;

    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3, backoff = @Backoff(delay = 200, multiplier = 2))
    @Transactional
    public int commit(Stage stage, List<UUID> paperIds, List<ArtifactRecord> artifacts, boolean replace) {
        if (replace) {
            artifactRepository.deleteByPaperIds(stage, paperIds);
        }
        int written = artifacts.isEmpty() ? 0 : artifactRepository.saveAll(stage, artifacts, replace);

        for (UUID paperId : paperIds) {
            ledgerRepository.mark(paperId, stage, LedgerStatus.DONE, null);
        }

        log.debug("Stage {}: committed {} artifacts for {}", stage.stageName(), written, paperIds);
        return written;
    }

    /**
     * Marks the unit FAILED. With {@code discard} the artifacts of an earlier generation go too,
     * so a failed forced regeneration leaves nothing stale behind.
     */
    @Transactional
    public void fail(Stage stage, List<UUID> paperIds, String error, boolean discard) {
        if (discard && stage.producesArtifacts()) {
            artifactRepository.deleteByPaperIds(stage, paperIds);
        }
        for (UUID paperId : paperIds) {
            ledgerRepository.mark(paperId, stage, LedgerStatus.FAILED, error);
        }
    }

    /**
     * Hands claimed entries back in the status and with the error they had before the claim.
     */
    @Transactional
    public void release(Stage stage, List<LedgerEntry> previous) {
        for (LedgerEntry entry : previous) {
            ledgerRepository.mark(entry.paperId(), stage, entry.status(), entry.errorMessage());
        }
    }
}
