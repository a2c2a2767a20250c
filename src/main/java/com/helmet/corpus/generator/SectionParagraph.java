package com.helmet.corpus.generator;

public record SectionParagraph(
    String section,
    String text
) {}
