package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionEstimate;
import com.example.pdfcompress.domain.model.CompressionOptions;

import org.springframework.stereotype.Component;

/**
 * Rough size estimate shown before the user starts a compression.
 */
@Component
public class CompressionEstimator {

	/**
	 * Applies a level factor and a quality factor to the original size.
	 *
	 * @param fileSize original size in bytes
	 * @param options  requested options
	 * @return estimated output size
	 */
    public CompressionEstimate estimate(long fileSize, CompressionOptions options) {
        double levelFactor = switch (options.compressionLevel()) {
            case LOW -> 0.85;
            case MEDIUM -> 0.65;
            case HIGH -> options.preserveQuality() ? 0.5 : 0.3;
        };
        // 0.5 at quality 0, 1.0 at quality 100
        double qualityFactor = 1 - ((100 - options.quality()) / 200.0);
        long estimated = (long) Math.floor(fileSize * levelFactor * qualityFactor);
        return new CompressionEstimate(fileSize, estimated, options);
    }
}
