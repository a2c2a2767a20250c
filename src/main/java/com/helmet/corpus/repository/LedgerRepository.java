package com.helmet.corpus.repository;

import com.helmet.corpus.model.LedgerEntry;
import com.helmet.corpus.model.LedgerStatus;
import com.helmet.corpus.model.Stage;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface LedgerRepository {
    void seed(UUID paperId, Collection<Stage> stages);
    void mark(UUID paperId, Stage stage, LedgerStatus status, String error);

    /**
     * Compare-and-swap into {@link LedgerStatus#RUNNING}. Succeeds only if the current status
     * (PENDING when no row exists yet) is one of {@code expected}.
     */
    boolean claim(UUID paperId, Stage stage, Collection<LedgerStatus> expected);

    Optional<LedgerEntry> find(UUID paperId, Stage stage);
    List<LedgerEntry> findByPaperId(UUID paperId);
    List<UUID> resetStaleRunning(Stage stage, int staleThresholdMinutes);
    int countByStatus(Stage stage, LedgerStatus status);
}
