package com.example.pdfcompress.domain.model;

/**
 * Properties of an image XObject that the transform policy looks at.
 *
 * @param width        declared pixel width, or a non-positive value when missing
 * @param height       declared pixel height, or a non-positive value when missing
 * @param codec        current encoding
 * @param stencilMask  {@code true} for {@code /ImageMask true} images
 * @param colorKeyMask {@code true} when {@code Mask} is a colour-key range array
 */
public record ImageDescriptor(int width, int height, ImageCodec codec, boolean stencilMask, boolean colorKeyMask) {

    public boolean hasDimensions() {
        return width > 0 && height > 0;
    }
}
