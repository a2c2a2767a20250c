package com.helmet.corpus.model;

public enum LedgerStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED
}
