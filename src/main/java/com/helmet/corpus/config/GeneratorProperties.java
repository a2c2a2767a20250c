package com.helmet.corpus.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Knobs of the three artifact generators. Changing any value that affects output content
 * should be accompanied by a bump of {@code version}, which is folded into label seeds and
 * stored on every artifact.
 */
@Validated
@ConfigurationProperties(prefix = "app.generator")
public record GeneratorProperties(
	@NotBlank String version,
	@Valid @NotNull Query query,
	@Valid @NotNull Synthesis synthesis,
	@Valid @NotNull Label label
) {

	public record Query(
		@NotEmpty List<String> targetFields
	) {}

	public record Synthesis(
		@NotBlank String groupBy,
		@NotNull @Min(1) Integer maxBatchSize,
		@NotEmpty List<String> dimensions
	) {}

	public record Label(
		@NotNull @Min(1) Integer snippetsPerPaper,
		@NotNull @Min(2) Integer choices,
		@NotNull @Min(2) Integer minSections,
		@NotNull @Min(20) Integer maxSnippetChars
	) {}
}
