package com.helmet.corpus.generator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HealthEconomicFieldExtractorTest {

    private static final List<String> ALL_FIELDS = List.of("treatment", "cost", "qaly", "icer", "perspective", "time_horizon");

    private final HealthEconomicFieldExtractor extractor = new HealthEconomicFieldExtractor();

    @Test
    @DisplayName("Should read treatment, cost and QALY gain from a single sentence")
    void shouldExtractStatedValues() {
        Map<String, String> values = extractor.extract("Drug X reduced cost by $500 and improved QALY by 0.2", ALL_FIELDS);

        assertThat(values).containsExactly(
            Map.entry("treatment", "Drug X"),
            Map.entry("cost", "$500"),
            Map.entry("qaly", "0.2")
        );
    }

    @Test
    @DisplayName("Should read ICER and time horizon")
    void shouldExtractIcerAndHorizon() {
        Map<String, String> values = extractor.extract(
            "Over a lifetime horizon the ICER was $25,000 per QALY gained.", List.of("icer", "time_horizon"));

        assertThat(values)
            .containsEntry("icer", "$25,000")
            .containsEntry("time_horizon", "lifetime");
    }

    @Test
    @DisplayName("Should read the analysis perspective")
    void shouldExtractPerspective() {
        assertThat(extractor.find("The analysis was conducted from the healthcare payer perspective.", "perspective"))
            .contains("healthcare payer");
    }

    @Test
    @DisplayName("Unknown or unmatched fields are left out")
    void shouldOmitMissingFields() {
        Map<String, String> values = extractor.extract("Patients were followed for a 10-year time horizon.",
            List.of("cost", "time_horizon", "country"));

        assertThat(values).containsOnlyKeys("time_horizon");
        assertThat(extractor.extract("   ", ALL_FIELDS)).isEmpty();
    }
}
