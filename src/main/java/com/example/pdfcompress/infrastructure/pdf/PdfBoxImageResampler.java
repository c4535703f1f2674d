package com.example.pdfcompress.infrastructure.pdf;

import com.example.pdfcompress.domain.model.ImageCodec;
import com.example.pdfcompress.domain.model.ImageDescriptor;
import com.example.pdfcompress.domain.model.ImageTransformDecision;

import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSStream;
import org.apache.pdfbox.pdmodel.common.PDStream;
import org.apache.pdfbox.pdmodel.graphics.image.JPEGFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

/**
 * Re-encodes image XObjects with PDFBox's JPEG encoder.
 * <p>
 * The new encoding is written into the <em>same</em> {@link COSStream} so every reference to the
 * image, from any page or form, keeps pointing at a valid object.
 * </p>
 */
@Component
public class PdfBoxImageResampler {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxImageResampler.class);

    private static final List<COSName> ENCODING_KEYS = List.of(
            COSName.FILTER,
            COSName.DECODE_PARMS,
            COSName.DECODE,
            COSName.COLORSPACE,
            COSName.BITS_PER_COMPONENT,
            COSName.WIDTH,
            COSName.HEIGHT,
            COSName.SMASK,
            COSName.MASK,
            COSName.getPDFName("SMaskInData")
    );

	/**
	 * Reads the entries of an image stream that the transform policy needs.
	 *
	 * @param image image XObject stream
	 * @return descriptor of the image as currently encoded
	 */
    public ImageDescriptor describe(COSStream image) {
        int width = image.getInt(COSName.WIDTH, -1);
        int height = image.getInt(COSName.HEIGHT, -1);
        boolean stencilMask = image.getBoolean(COSName.IMAGE_MASK, false);
        boolean colorKeyMask = image.getDictionaryObject(COSName.MASK) instanceof COSArray;
        return new ImageDescriptor(width, height, resolveCodec(image), stencilMask, colorKeyMask);
    }

	/**
	 * Downsamples the image to the decision's target size and stores it as JPEG.
	 *
	 * @param graph       owning graph, used by the encoder to allocate streams
	 * @param image       image stream to rewrite in place
	 * @param decision    resample decision with target dimensions
	 * @param jpegQuality encoder quality in {@code (0, 1]}
	 * @return {@code true} when the stream was replaced, {@code false} when the new encoding was not smaller
	 * @throws IOException when the image cannot be decoded or encoded
	 */
    public boolean resample(DocumentGraph graph, COSStream image, ImageTransformDecision decision, float jpegQuality)
            throws IOException {
        if (!decision.shouldResample()) {
            return false;
        }
        PDImageXObject source = new PDImageXObject(new PDStream(image), null);
        BufferedImage decoded = source.getImage();
        BufferedImage scaled = scale(decoded, decision.targetWidth(), decision.targetHeight());

        PDImageXObject encoded = JPEGFactory.createFromImage(graph.document(), scaled, jpegQuality);
        COSStream replacement = encoded.getCOSObject();

        long originalLength = image.getLength();
        long replacementLength = replacement.getLength();
        if (originalLength > 0 && replacementLength >= originalLength) {
            log.debug("Keeping original {}x{} image: re-encoded size {} is not below {}",
                    decoded.getWidth(), decoded.getHeight(), replacementLength, originalLength);
            return false;
        }
        replaceEncoding(image, replacement);
        log.debug("Resampled image {}x{} -> {}x{} ({} -> {} bytes)",
                decoded.getWidth(), decoded.getHeight(), decision.targetWidth(), decision.targetHeight(),
                originalLength, replacementLength);
        return true;
    }

    private ImageCodec resolveCodec(COSStream image) {
        COSBase filter = image.getDictionaryObject(COSName.FILTER);
        if (filter instanceof COSName name) {
            return ImageCodec.fromFilterName(name.getName());
        }
        if (filter instanceof COSArray filters && filters.size() > 0) {
            // the last filter is the one closest to the pixels
            COSBase last = filters.getObject(filters.size() - 1);
            if (last instanceof COSName name) {
                return ImageCodec.fromFilterName(name.getName());
            }
            return ImageCodec.OTHER;
        }
        return filter == null ? ImageCodec.UNFILTERED : ImageCodec.OTHER;
    }

    private BufferedImage scale(BufferedImage original, int targetWidth, int targetHeight) {
        int type;
        if (original.getColorModel().hasAlpha()) {
            type = BufferedImage.TYPE_INT_ARGB;
        } else if (original.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            type = BufferedImage.TYPE_BYTE_GRAY;
        } else {
            type = BufferedImage.TYPE_INT_RGB;
        }
        BufferedImage scaled = new BufferedImage(targetWidth, targetHeight, type);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            graphics.drawImage(original, 0, 0, targetWidth, targetHeight, null);
        } finally {
            graphics.dispose();
        }
        return scaled;
    }

	/**
	 * Moves the encoded data and the encoding entries of {@code replacement} into {@code target}.
	 * The payload is read completely before {@code target} is touched, so a read failure leaves the
	 * original image as it was.
	 *
	 * @param target      image stream referenced from the document
	 * @param replacement freshly encoded image stream
	 * @throws IOException when either stream cannot be read or written
	 */
    void replaceEncoding(COSStream target, COSStream replacement) throws IOException {
        byte[] payload;
        try (InputStream in = replacement.createRawInputStream()) {
            payload = in.readAllBytes();
        }
        try (OutputStream out = target.createRawOutputStream()) {
            out.write(payload);
        }
        ENCODING_KEYS.forEach(target::removeItem);
        for (Map.Entry<COSName, COSBase> entry : replacement.entrySet()) {
            if (!COSName.LENGTH.equals(entry.getKey())) {
                target.setItem(entry.getKey(), entry.getValue());
            }
        }
    }
}
