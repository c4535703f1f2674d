package com.example.pdfcompress.application.service;

import com.example.pdfcompress.application.exception.DocumentCompressionException;
import com.example.pdfcompress.config.CompressionProperties;
import com.example.pdfcompress.domain.exception.InvalidCompressionOptionsException;
import com.example.pdfcompress.domain.exception.PdfFileRequiredException;
import com.example.pdfcompress.domain.exception.UnsupportedPdfFormatException;
import com.example.pdfcompress.domain.model.CompressionEstimate;
import com.example.pdfcompress.domain.model.CompressionLevel;
import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.domain.model.CompressionOutcome;
import com.example.pdfcompress.domain.model.CompressionRequest;
import com.example.pdfcompress.infrastructure.exception.PdfLoadException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Application-layer entry point used by the HTTP host.
 * It validates uploads, resolves options against the configured defaults and hands requests to the worker.
 */
@Service
public class DocumentCompressionService {

    private static final Logger log = LoggerFactory.getLogger(DocumentCompressionService.class);
    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final int HEADER_SEARCH_WINDOW = 1024;

    private final CompressionWorker worker;
    private final CompressionEstimator estimator;
    private final CompressionProperties properties;

    /**
     * Creates the service with its collaborators.
     *
     * @param worker     background executor of requests
     * @param estimator  size estimator
     * @param properties configured defaults
     */
    public DocumentCompressionService(CompressionWorker worker,
                                      CompressionEstimator estimator,
                                      CompressionProperties properties) {
        this.worker = worker;
        this.estimator = estimator;
        this.properties = properties;
    }

	/**
	 * Builds options from raw request parameters, falling back to configured defaults for missing ones.
	 *
	 * @param quality         0..100 or {@code null}
	 * @param level           {@code low}, {@code medium}, {@code high} or {@code null}
	 * @param preserveQuality flag or {@code null}
	 * @return validated options
	 * @throws InvalidCompressionOptionsException when a value is out of range or unknown
	 */
    public CompressionOptions resolveOptions(Integer quality, String level, Boolean preserveQuality) {
        CompressionLevel resolvedLevel = properties.defaultLevel();
        if (level != null && !level.isBlank()) {
            resolvedLevel = CompressionLevel.fromString(level);
            if (resolvedLevel == null) {
                throw new InvalidCompressionOptionsException("Unknown compression level: " + level);
            }
        }
        return new CompressionOptions(
                quality != null ? quality : properties.defaultQuality(),
                resolvedLevel,
                preserveQuality != null ? preserveQuality : properties.defaultPreserveQuality()
        );
    }

	/**
	 * Compresses the upload and waits for the outcome.
	 *
	 * @param file    uploaded PDF
	 * @param options resolved options
	 * @return the success payload
	 * @throws PdfFileRequiredException      when the file is missing or empty
	 * @throws UnsupportedPdfFormatException when the upload does not look like a PDF
	 * @throws DocumentCompressionException  when the request ends with a failure, times out or is interrupted
	 */
    public CompressionOutcome.Success compress(MultipartFile file, CompressionOptions options) {
        CompressionHandle handle = worker.submit(toRequest(file, options), CompressionListener.NONE);
        long timeoutMillis = properties.requestTimeout().toMillis();
        try {
            CompressionOutcome outcome = handle.outcome().get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (outcome instanceof CompressionOutcome.Success success) {
                return success;
            }
            throw new DocumentCompressionException(((CompressionOutcome.Failure) outcome).errorMessage());
        } catch (TimeoutException ex) {
            handle.cancel();
            throw new DocumentCompressionException("Compression did not finish within " + timeoutMillis + " ms.", ex);
        } catch (InterruptedException ex) {
            handle.cancel();
            Thread.currentThread().interrupt();
            throw new DocumentCompressionException("Compression was interrupted.", ex);
        } catch (CancellationException ex) {
            throw new DocumentCompressionException("Compression was cancelled.", ex);
        } catch (ExecutionException ex) {
            throw new DocumentCompressionException("Compression failed unexpectedly.", ex.getCause());
        }
    }

	/**
	 * Submits the upload without waiting; messages flow to {@code listener}.
	 *
	 * @param file     uploaded PDF
	 * @param options  resolved options
	 * @param listener receiver of progress events and the outcome
	 * @return handle to cancel the request
	 */
    public CompressionHandle compressAsync(MultipartFile file, CompressionOptions options, CompressionListener listener) {
        return worker.submit(toRequest(file, options), listener);
    }

    public CompressionEstimate estimate(long fileSize, CompressionOptions options) {
        if (fileSize < 0) {
            throw new InvalidCompressionOptionsException("File size must not be negative.");
        }
        return estimator.estimate(fileSize, options);
    }

    private CompressionRequest toRequest(MultipartFile file, CompressionOptions options) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new PdfLoadException("Unable to read the uploaded PDF file.", e);
        }
        if (!looksLikePdf(file, bytes)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }
        log.debug("Accepted upload {} ({} bytes)", file.getOriginalFilename(), bytes.length);
        return new CompressionRequest(bytes, options);
    }

    /**
     * Performs a lightweight PDF detection check based on MIME type, file name and header bytes.
     *
     * @param file  uploaded file
     * @param bytes its content
     * @return {@code true} when any of the three indicates a PDF
     */
    private boolean looksLikePdf(MultipartFile file, byte[] bytes) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return true;
        }
        return hasPdfHeader(bytes);
    }

    static boolean hasPdfHeader(byte[] bytes) {
        int limit = Math.min(bytes.length, HEADER_SEARCH_WINDOW) - PDF_MAGIC.length;
        for (int offset = 0; offset <= limit; offset++) {
            boolean match = true;
            for (int i = 0; i < PDF_MAGIC.length && match; i++) {
                match = bytes[offset + i] == PDF_MAGIC[i];
            }
            if (match) {
                return true;
            }
        }
        return false;
    }
}
