package com.helmet.corpus.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class ConflictException extends RuntimeException {
    private final UUID paperId;

    public ConflictException(UUID paperId, String message) {
        super(message);
        this.paperId = paperId;
    }
}
