package com.helmet.corpus.model;

public record IngestedPaper(
    PaperRecord paper,
    IndexEntry entry
) {}
