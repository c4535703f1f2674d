package com.example.pdfcompress.application.service.stage;

import com.example.pdfcompress.application.service.ImageTransformPolicy;
import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.domain.model.ImageDescriptor;
import com.example.pdfcompress.domain.model.ImageTransformDecision;
import com.example.pdfcompress.domain.model.PipelineStage;
import com.example.pdfcompress.infrastructure.pdf.DocumentGraph;
import com.example.pdfcompress.infrastructure.pdf.PageNode;
import com.example.pdfcompress.infrastructure.pdf.PdfBoxImageResampler;

import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds every image XObject reachable from page resources, including images nested in form
 * XObjects, and downsamples the eligible ones. Shared images are handled once.
 * A single image that fails to decode or encode is left as it was.
 */
@Component
public class ProcessImagesStage implements CompressionStage {

    private static final Logger log = LoggerFactory.getLogger(ProcessImagesStage.class);

    private final ImageTransformPolicy policy;
    private final PdfBoxImageResampler resampler;

    public ProcessImagesStage(ImageTransformPolicy policy, PdfBoxImageResampler resampler) {
        this.policy = policy;
        this.resampler = resampler;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.PROCESS_IMAGES;
    }

    @Override
    public int apply(DocumentGraph graph, CompressionOptions options) {
        ImageWalk walk = new ImageWalk(graph, options);
        for (PageNode page : graph.pages()) {
            page.resources().ifPresent(walk::visitResources);
        }
        log.debug("Processed {} images, resampled {}", walk.images, walk.resampled);
        return walk.resampled;
    }

    /**
     * State of one traversal; every node is visited at most once.
     */
    private final class ImageWalk {

        private final DocumentGraph graph;
        private final CompressionOptions options;
        private final float jpegQuality;
        private final Set<COSBase> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        private int images;
        private int resampled;

        private ImageWalk(DocumentGraph graph, CompressionOptions options) {
            this.graph = graph;
            this.options = options;
            this.jpegQuality = policy.jpegQuality(options);
        }

        private void visitResources(COSDictionary resources) {
            if (!visited.add(resources)) {
                return;
            }
            Optional<COSDictionary> xObjects = graph.resolveDictionary(resources.getItem(COSName.XOBJECT));
            if (xObjects.isEmpty()) {
                return;
            }
            List<COSName> names = new ArrayList<>(xObjects.get().keySet());
            for (COSName name : names) {
                graph.resolveStream(xObjects.get().getItem(name)).ifPresent(this::visitXObject);
            }
        }

        private void visitXObject(COSStream xObject) {
            if (!visited.add(xObject)) {
                return;
            }
            COSName subtype = xObject.getCOSName(COSName.SUBTYPE);
            if (COSName.IMAGE.equals(subtype)) {
                visitImage(xObject);
            } else if (COSName.FORM.equals(subtype)) {
                graph.resolveDictionary(xObject.getItem(COSName.RESOURCES)).ifPresent(this::visitResources);
            }
        }

        private void visitImage(COSStream image) {
            images++;
            ImageDescriptor descriptor = resampler.describe(image);
            ImageTransformDecision decision = policy.decide(descriptor, options);
            if (!decision.shouldResample()) {
                log.trace("Skipping {}x{} image: {}", descriptor.width(), descriptor.height(), decision.skipReason());
                return;
            }
            try {
                if (resampler.resample(graph, image, decision, jpegQuality)) {
                    resampled++;
                }
            } catch (IOException | RuntimeException ex) {
                log.warn("Could not resample {}x{} {} image: {}",
                        descriptor.width(), descriptor.height(), descriptor.codec(), ex.getMessage());
            }
        }
    }
}
