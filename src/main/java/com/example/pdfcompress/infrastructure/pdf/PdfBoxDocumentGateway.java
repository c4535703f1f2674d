package com.example.pdfcompress.infrastructure.pdf;

import com.example.pdfcompress.infrastructure.exception.PdfLoadException;
import com.example.pdfcompress.infrastructure.exception.PdfSaveException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdfwriter.compress.CompressParameters;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Infrastructure adapter that turns bytes into a {@link DocumentGraph} and back using PDFBox.
 * Hides the PDFBox loading and writing details from the pipeline.
 */
@Component
public class PdfBoxDocumentGateway {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentGateway.class);

	/**
	 * Parses the document leniently. Documents encrypted without a user password are opened and
	 * flagged so that they are written back without security.
	 *
	 * @param bytes raw document bytes
	 * @return the loaded graph, owned by the caller
	 * @throws PdfLoadException when the bytes are not a usable PDF or a password is required
	 */
    public DocumentGraph parse(byte[] bytes) {
        PDDocument document;
        try {
            document = Loader.loadPDF(bytes);
        } catch (InvalidPasswordException ex) {
            throw new PdfLoadException("The PDF is password protected and cannot be compressed.", ex);
        } catch (IOException | RuntimeException ex) {
            throw new PdfLoadException("The file could not be read as a PDF document.", ex);
        }
        if (document.isEncrypted()) {
            log.info("Document is encrypted without a user password; security will be removed on save");
            document.setAllSecurityToBeRemoved(true);
        }
        return new DocumentGraph(document);
    }

	/**
	 * Writes the graph. With {@code packObjectStreams} the writer groups eligible objects into
	 * object streams and only emits what is reachable from the trailer.
	 *
	 * @param graph             graph to serialize
	 * @param packObjectStreams whether to use object streams and a cross-reference stream
	 * @return the serialized document
	 * @throws PdfSaveException when the writer rejects the graph
	 */
    public byte[] serialize(DocumentGraph graph, boolean packObjectStreams) {
        CompressParameters parameters = packObjectStreams
                ? CompressParameters.DEFAULT_COMPRESSION
                : CompressParameters.NO_COMPRESSION;
        try (ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            graph.document().save(outputStream, parameters);
            return outputStream.toByteArray();
        } catch (IOException | RuntimeException ex) {
            throw new PdfSaveException("Unable to write the compressed PDF.", ex);
        }
    }
}
