package com.helmet.corpus.extraction;

import com.helmet.corpus.exception.ExtractionException;
import com.helmet.corpus.model.PaperMetadata;

/**
 * Maps the raw content of a fetched paper to structured metadata.
 */
@FunctionalInterface
public interface PaperMetadataExtractor {

    /**
     * @throws ExtractionException when required fields cannot be populated; the exception
     *                             carries the partial metadata that was extracted
     */
    PaperMetadata extract(String rawContent);
}
