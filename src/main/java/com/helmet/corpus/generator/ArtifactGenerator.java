package com.helmet.corpus.generator;

import com.helmet.corpus.exception.GenerationException;
import com.helmet.corpus.model.ArtifactRecord;
import com.helmet.corpus.model.Stage;
import com.helmet.corpus.model.WorkUnit;

import java.util.List;

/**
 * Derives artifacts for one stage from index entries and their papers.
 * <p>
 * Implementations are deterministic: the same unit under the same generator version yields the
 * same payloads in the same order, and therefore the same sequence indices and artifact ids.
 */
public sealed interface ArtifactGenerator permits QueryGenerator, EvidenceSynthesisGenerator, LabelGenerator {

    Stage stage();

    String version();

    /**
     * @throws GenerationException when an upstream field the stage depends on is missing;
     *                             nothing must be persisted for the unit in that case
     */
    List<ArtifactRecord> generate(WorkUnit unit);
}
