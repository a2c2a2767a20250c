package com.helmet.corpus.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
	@NotNull @Min(1) @Max(64) Integer workerConcurrency,
	@NotNull @Min(1) @Max(10_000) Integer pageSize,
	@NotNull @Min(0) Integer staleThresholdMinutes
) {}
