package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.domain.model.ImageDescriptor;
import com.example.pdfcompress.domain.model.ImageTransformDecision;
import com.example.pdfcompress.domain.model.ImageTransformDecision.SkipReason;

import org.springframework.stereotype.Component;

/**
 * Decides how aggressively each embedded image is downsampled.
 * Pure and deterministic: identical inputs always produce identical decisions.
 */
@Component
public class ImageTransformPolicy {

    public static final int MIN_DIMENSION = 100;
    public static final int LARGE_DIMENSION = 1000;

    private static final double LARGE_IMAGE_MODIFIER = 0.8;
    private static final double LOW_QUALITY_MODIFIER = 0.7;
    private static final int LOW_QUALITY_THRESHOLD = 30;
    private static final float MIN_JPEG_QUALITY = 0.1f;

	/**
	 * Computes the decision for one image.
	 *
	 * @param image   current image properties
	 * @param options request options
	 * @return a skip decision or the target scale factor and pixel size
	 */
    public ImageTransformDecision decide(ImageDescriptor image, CompressionOptions options) {
        if (!image.hasDimensions()) {
            return ImageTransformDecision.skip(SkipReason.MISSING_DIMENSIONS, 1.0);
        }
        int width = image.width();
        int height = image.height();
        if (width < MIN_DIMENSION || height < MIN_DIMENSION) {
            return ImageTransformDecision.skip(SkipReason.BELOW_MINIMUM_SIZE, 1.0);
        }
        if (image.stencilMask() || image.codec().isBilevel()) {
            return ImageTransformDecision.skip(SkipReason.BILEVEL_CODEC, 1.0);
        }
        if (image.colorKeyMask()) {
            return ImageTransformDecision.skip(SkipReason.COLOR_KEY_MASK, 1.0);
        }

        double factor = scaleFactor(width, height, options);
        if (image.codec().isWavelet() && !options.isHigh()) {
            return ImageTransformDecision.skip(SkipReason.WAVELET_CODEC, factor);
        }
        if (factor >= 1.0) {
            return ImageTransformDecision.skip(SkipReason.NO_DOWNSAMPLING, factor);
        }
        int targetWidth = Math.max(1, (int) Math.round(width * factor));
        int targetHeight = Math.max(1, (int) Math.round(height * factor));
        return ImageTransformDecision.resample(factor, targetWidth, targetHeight);
    }

	/**
	 * Base factor by level and quality, then the large-image and low-quality modifiers, in that order.
	 *
	 * @param width   image width in pixels
	 * @param height  image height in pixels
	 * @param options request options
	 * @return scale factor in {@code (0, 1]}
	 */
    public double scaleFactor(int width, int height, CompressionOptions options) {
        double factor = baseFactor(options);
        if (width > LARGE_DIMENSION || height > LARGE_DIMENSION) {
            factor *= LARGE_IMAGE_MODIFIER;
        }
        if (options.isHigh() && options.quality() < LOW_QUALITY_THRESHOLD) {
            factor *= LOW_QUALITY_MODIFIER;
        }
        return factor;
    }

    /**
     * JPEG encoder quality derived from the 0..100 request quality.
     */
    public float jpegQuality(CompressionOptions options) {
        float quality = options.quality() / 100f;
        return Math.max(MIN_JPEG_QUALITY, Math.min(1.0f, quality));
    }

    private double baseFactor(CompressionOptions options) {
        int quality = options.quality();
        return switch (options.compressionLevel()) {
            case LOW -> quality > 80 ? 1.0 : 0.9;
            case MEDIUM -> quality > 60 ? 0.8 : 0.7;
            case HIGH -> quality > 40 ? 0.6 : 0.5;
        };
    }
}
