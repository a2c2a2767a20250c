package com.helmet.corpus.repository;

import com.helmet.corpus.model.ArtifactRecord;
import com.helmet.corpus.model.Stage;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ArtifactRepository {

    /**
     * Persists the records into the stage's store. Without {@code replace} an existing
     * artifact id is left untouched; with it the stored record is overwritten.
     *
     * @return number of rows inserted or replaced
     */
    int saveAll(Stage stage, List<ArtifactRecord> records, boolean replace);

    /**
     * Removes the stage's artifacts of the given papers. Synthesis batches only lose those
     * papers as members and are dropped once no member is left.
     */
    int deleteByPaperIds(Stage stage, Collection<UUID> paperIds);

    List<ArtifactRecord> findByPaperId(Stage stage, UUID paperId);
    int countByPaperId(Stage stage, UUID paperId);
    boolean isReferenced(UUID paperId);
}
