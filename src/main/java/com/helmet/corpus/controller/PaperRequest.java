package com.helmet.corpus.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record PaperRequest(
    @NotBlank
    @JsonProperty("raw_content")
    String rawContent
) {}
