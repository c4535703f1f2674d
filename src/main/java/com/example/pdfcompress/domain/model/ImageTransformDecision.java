package com.example.pdfcompress.domain.model;

/**
 * Outcome of the image transform policy for a single image.
 *
 * @param skipReason   why the image is left untouched, {@code null} when it should be resampled
 * @param scaleFactor  factor applied to both dimensions, in {@code (0, 1]}
 * @param targetWidth  target pixel width, {@code 0} when skipped
 * @param targetHeight target pixel height, {@code 0} when skipped
 */
public record ImageTransformDecision(SkipReason skipReason, double scaleFactor, int targetWidth, int targetHeight) {

    public static ImageTransformDecision skip(SkipReason reason, double scaleFactor) {
        return new ImageTransformDecision(reason, scaleFactor, 0, 0);
    }

    public static ImageTransformDecision resample(double scaleFactor, int targetWidth, int targetHeight) {
        return new ImageTransformDecision(null, scaleFactor, targetWidth, targetHeight);
    }

    public boolean shouldResample() {
        return skipReason == null;
    }

    /**
     * Reasons an eligible-looking image is not re-encoded.
     */
    public enum SkipReason {
        MISSING_DIMENSIONS,
        BELOW_MINIMUM_SIZE,
        NO_DOWNSAMPLING,
        WAVELET_CODEC,
        BILEVEL_CODEC,
        COLOR_KEY_MASK
    }
}
