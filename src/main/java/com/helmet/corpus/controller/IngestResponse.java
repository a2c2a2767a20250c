package com.helmet.corpus.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IngestResponse(
    PaperResponse paper,

    @JsonProperty("index_entry")
    IndexEntryResponse indexEntry
) {}
