package com.helmet.corpus.generator;

import java.util.List;

/**
 * Splits a paper's raw content into paragraphs tagged with the section they belong to, in
 * document order. Returns an empty list when the content carries no full text.
 */
@FunctionalInterface
public interface SnippetSegmenter {

    List<SectionParagraph> segment(String rawContent);
}
