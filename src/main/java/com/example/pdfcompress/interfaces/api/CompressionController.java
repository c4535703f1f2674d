package com.example.pdfcompress.interfaces.api;

import com.example.pdfcompress.application.service.CompressionHandle;
import com.example.pdfcompress.application.service.CompressionListener;
import com.example.pdfcompress.application.service.DocumentCompressionService;
import com.example.pdfcompress.config.CompressionProperties;
import com.example.pdfcompress.domain.model.CompressionEstimate;
import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.domain.model.CompressionOutcome;
import com.example.pdfcompress.domain.model.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Interfaces-layer REST controller that exposes document compression over HTTP.
 */
@RestController
@RequestMapping("/api/compress")
public class CompressionController {

    static final String ORIGINAL_SIZE_HEADER = "X-Original-Size";
    static final String COMPRESSED_SIZE_HEADER = "X-Compressed-Size";
    static final String COMPRESSION_RATIO_HEADER = "X-Compression-Ratio";

    private static final Logger log = LoggerFactory.getLogger(CompressionController.class);

    private final DocumentCompressionService compressionService;
    private final CompressionProperties properties;

    /**
     * Creates the controller with the required application service.
     *
     * @param compressionService service that validates and runs compression requests
     * @param properties         settings used for the streaming timeout
     */
    public CompressionController(DocumentCompressionService compressionService, CompressionProperties properties) {
        this.compressionService = compressionService;
        this.properties = properties;
    }

    /**
     * Compresses the upload and returns the resulting PDF as a download.
     *
     * @param file            uploaded PDF
     * @param quality         0..100, optional
     * @param compressionLevel low, medium or high, optional
     * @param preserveQuality optional flag
     * @return compressed document with size headers
     */
    @PostMapping
    public ResponseEntity<byte[]> compress(@RequestParam("file") MultipartFile file,
                                           @RequestParam(value = "quality", required = false) Integer quality,
                                           @RequestParam(value = "compressionLevel", required = false) String compressionLevel,
                                           @RequestParam(value = "preserveQuality", required = false) Boolean preserveQuality) {
        CompressionOptions options = compressionService.resolveOptions(quality, compressionLevel, preserveQuality);
        CompressionOutcome.Success result = compressionService.compress(file, options);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(compressedFileName(file.getOriginalFilename()), StandardCharsets.UTF_8)
                .build());
        headers.set(ORIGINAL_SIZE_HEADER, Long.toString(result.originalSize()));
        headers.set(COMPRESSED_SIZE_HEADER, Long.toString(result.outputSize()));
        headers.set(COMPRESSION_RATIO_HEADER, String.format(Locale.ROOT, "%.4f", result.ratio()));

        return ResponseEntity.ok()
                .headers(headers)
                .contentType(MediaType.APPLICATION_PDF)
                .body(result.outputBytes());
    }

    /**
     * Compresses the upload in the background and streams progress as Server-Sent Events.
     * The stream carries {@code progress} events followed by exactly one {@code complete} or {@code error} event.
     *
     * @param file            uploaded PDF
     * @param quality         0..100, optional
     * @param compressionLevel low, medium or high, optional
     * @param preserveQuality optional flag
     * @return event stream bound to the request
     */
    @PostMapping("/stream")
    public SseEmitter compressWithProgress(@RequestParam("file") MultipartFile file,
                                           @RequestParam(value = "quality", required = false) Integer quality,
                                           @RequestParam(value = "compressionLevel", required = false) String compressionLevel,
                                           @RequestParam(value = "preserveQuality", required = false) Boolean preserveQuality) {
        CompressionOptions options = compressionService.resolveOptions(quality, compressionLevel, preserveQuality);
        SseEmitter emitter = new SseEmitter(properties.requestTimeout().toMillis());
        AtomicReference<CompressionHandle> handle = new AtomicReference<>();

        CompressionHandle submitted = compressionService.compressAsync(file, options, new CompressionListener() {
            @Override
            public void onProgress(ProgressEvent event) {
                send(emitter, handle, SseEmitter.event().name("progress").data(event, MediaType.APPLICATION_JSON));
            }

            @Override
            public void onOutcome(CompressionOutcome outcome) {
                String name = outcome.isSuccess() ? "complete" : "error";
                Object payload = outcomePayload(outcome);
                if (send(emitter, handle, SseEmitter.event().name(name).data(payload, MediaType.APPLICATION_JSON))) {
                    emitter.complete();
                }
            }
        });
        handle.set(submitted);

        emitter.onTimeout(() -> {
            log.info("Progress stream timed out; cancelling compression");
            submitted.cancel();
            emitter.complete();
        });
        emitter.onError(error -> submitted.cancel());
        return emitter;
    }

    /**
     * Returns a quick estimate of the compressed size.
     *
     * @param fileSize         size of the document in bytes
     * @param quality          0..100, optional
     * @param compressionLevel low, medium or high, optional
     * @param preserveQuality  optional flag
     * @return estimate for the given options
     */
    @GetMapping(value = "/estimate", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<CompressionEstimate> estimate(@RequestParam("fileSize") long fileSize,
                                                        @RequestParam(value = "quality", required = false) Integer quality,
                                                        @RequestParam(value = "compressionLevel", required = false) String compressionLevel,
                                                        @RequestParam(value = "preserveQuality", required = false) Boolean preserveQuality) {
        CompressionOptions options = compressionService.resolveOptions(quality, compressionLevel, preserveQuality);
        return ResponseEntity.ok(compressionService.estimate(fileSize, options));
    }

    private boolean send(SseEmitter emitter, AtomicReference<CompressionHandle> handle, SseEmitter.SseEventBuilder event) {
        try {
            emitter.send(event);
            return true;
        } catch (IOException | IllegalStateException ex) {
            log.info("Client left the progress stream: {}", ex.getMessage());
            CompressionHandle current = handle.get();
            if (current != null) {
                current.cancel();
            }
            emitter.completeWithError(ex);
            return false;
        }
    }

    static Object outcomePayload(CompressionOutcome outcome) {
        if (outcome instanceof CompressionOutcome.Success success) {
            return new CompletePayload(success.outputBytes(), success.originalSize(), success.outputSize(), success.ratio());
        }
        return new ErrorPayload(((CompressionOutcome.Failure) outcome).errorMessage());
    }

    static String compressedFileName(String originalName) {
        if (originalName == null || originalName.isBlank()) {
            return "compressed.pdf";
        }
        String base = originalName.replaceAll("(?i)\\.pdf$", "");
        return base + "-compressed.pdf";
    }

    /**
     * Body of the {@code complete} event. {@code outputBytes} is serialized as Base64.
     */
    public record CompletePayload(byte[] outputBytes, long originalSize, long outputSize, double ratio) {
    }

    /**
     * Body of the {@code error} event.
     */
    public record ErrorPayload(String errorMessage) {
    }
}
