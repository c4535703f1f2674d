package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionEstimate;
import com.example.pdfcompress.domain.model.CompressionLevel;
import com.example.pdfcompress.domain.model.CompressionOptions;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the pre-compression size estimate.
 */
class CompressionEstimatorTest {

    private final CompressionEstimator estimator = new CompressionEstimator();

    @ParameterizedTest
    @CsvSource({
            "LOW, 100, true, 850000",
            "MEDIUM, 100, true, 650000",
            "HIGH, 100, true, 500000",
            "HIGH, 100, false, 300000",
            "MEDIUM, 0, true, 325000",
            "LOW, 80, false, 765000"
    })
    void estimateAppliesLevelAndQualityFactors(CompressionLevel level, int quality, boolean preserve, long expected) {
        CompressionEstimate estimate = estimator.estimate(1_000_000, new CompressionOptions(quality, level, preserve));

        assertThat(estimate.fileSize()).isEqualTo(1_000_000);
        assertThat(estimate.estimatedSize()).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"0", "1", "999"})
    void estimateNeverExceedsTheInput(long fileSize) {
        CompressionEstimate estimate = estimator.estimate(fileSize, new CompressionOptions(100, CompressionLevel.LOW, true));

        assertThat(estimate.estimatedSize()).isBetween(0L, fileSize);
    }
}
