package com.example.pdfcompress.domain.model;

import com.example.pdfcompress.domain.exception.InvalidCompressionOptionsException;

/**
 * User-chosen compression settings attached to every request.
 *
 * @param quality          image quality between 0 and 100, higher keeps more detail
 * @param compressionLevel structural pruning preset
 * @param preserveQuality  keeps annotations and procedure sets even at {@link CompressionLevel#HIGH}
 */
public record CompressionOptions(
        int quality,
        CompressionLevel compressionLevel,
        boolean preserveQuality
) {

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 100;

    public CompressionOptions {
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new InvalidCompressionOptionsException(
                    "Quality must be between " + MIN_QUALITY + " and " + MAX_QUALITY + " but was " + quality + ".");
        }
        if (compressionLevel == null) {
            throw new InvalidCompressionOptionsException("Compression level must be one of low, medium or high.");
        }
    }

    public boolean isHigh() {
        return compressionLevel.isHigh();
    }

	/**
	 * Whether the aggressive, quality-sacrificing removals apply ({@code HIGH} without preserve-quality).
	 *
	 * @return {@code true} when annotations and procedure sets may be dropped
	 */
    public boolean allowsLossyPruning() {
        return compressionLevel.isHigh() && !preserveQuality;
    }
}
