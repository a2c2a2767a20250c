package com.helmet.corpus.exception;

import com.helmet.corpus.model.PaperMetadata;
import lombok.Getter;

/**
 * Raised by a metadata extractor that could not populate the required fields. Carries
 * whatever it did manage to extract so the paper can still be indexed.
 */
@Getter
public class ExtractionException extends RuntimeException {
    private final PaperMetadata partialMetadata;

    public ExtractionException(String message, PaperMetadata partialMetadata) {
        super(message);
        this.partialMetadata = partialMetadata;
    }

    public ExtractionException(String message, PaperMetadata partialMetadata, Throwable cause) {
        super(message, cause);
        this.partialMetadata = partialMetadata;
    }
}
