package com.helmet.corpus.model;

import java.util.Map;

public record PaperMetadata(
    String title,
    String abstractText,
    Map<String, String> fields
) {

    public static PaperMetadata empty() {
        return new PaperMetadata(null, null, Map.of());
    }

    public boolean hasAbstract() {
        return abstractText != null && !abstractText.isBlank();
    }
}
