package com.helmet.corpus.exception;

import com.helmet.corpus.model.Stage;
import lombok.Getter;

import java.util.UUID;

@Getter
public class GenerationException extends RuntimeException {
    private final UUID paperId;
    private final Stage stage;

    public GenerationException(UUID paperId, Stage stage, String message) {
        super(message);
        this.paperId = paperId;
        this.stage = stage;
    }
}
