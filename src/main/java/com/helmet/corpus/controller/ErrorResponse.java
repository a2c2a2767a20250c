package com.helmet.corpus.controller;

public record ErrorResponse(
    String message,
    int status,
    long timestamp
) {}
