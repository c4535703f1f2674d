package com.example.pdfcompress.infrastructure.pdf;

import com.example.pdfcompress.infrastructure.exception.PdfLoadException;
import com.example.pdfcompress.support.TestPdfs;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.encryption.AccessPermission;
import org.apache.pdfbox.pdmodel.encryption.StandardProtectionPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the PDFBox load and save adapter.
 */
class PdfBoxDocumentGatewayTest {

    private final PdfBoxDocumentGateway gateway = new PdfBoxDocumentGateway();

    @Test
    void parseRejectsBytesThatAreNotAPdf() {
        byte[] garbage = "definitely not a pdf".getBytes(StandardCharsets.US_ASCII);

        assertThatThrownBy(() -> gateway.parse(garbage))
                .isInstanceOf(PdfLoadException.class)
                .hasMessage("The file could not be read as a PDF document.");
    }

    @Test
    void parseRejectsDocumentsThatNeedAUserPassword() throws IOException {
        byte[] protectedPdf = encrypted("secret");

        assertThatThrownBy(() -> gateway.parse(protectedPdf))
                .isInstanceOf(PdfLoadException.class)
                .hasMessageContaining("password protected");
    }

    @Test
    void ownerPasswordOnlyDocumentIsWrittenBackWithoutSecurity() throws IOException {
        byte[] restricted = encrypted("");

        byte[] output;
        try (DocumentGraph graph = gateway.parse(restricted)) {
            assertThat(graph.document().isAllSecurityToBeRemoved()).isTrue();
            output = gateway.serialize(graph, true);
        }

        try (PDDocument reloaded = Loader.loadPDF(output)) {
            assertThat(reloaded.isEncrypted()).isFalse();
            assertThat(reloaded.getNumberOfPages()).isEqualTo(1);
        }
    }

    @Test
    void serializeWithAndWithoutObjectStreamsProducesLoadableDocuments() throws IOException {
        byte[] input = TestPdfs.richDocumentBytes();

        for (boolean pack : new boolean[]{true, false}) {
            byte[] output;
            try (DocumentGraph graph = gateway.parse(input)) {
                output = gateway.serialize(graph, pack);
            }
            assertThat(new String(output, 0, 5, StandardCharsets.US_ASCII)).isEqualTo("%PDF-");
            try (PDDocument reloaded = Loader.loadPDF(output)) {
                assertThat(reloaded.getNumberOfPages()).isEqualTo(2);
            }
        }
    }

    private static byte[] encrypted(String userPassword) throws IOException {
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            StandardProtectionPolicy policy = new StandardProtectionPolicy("owner-pass", userPassword, new AccessPermission());
            policy.setEncryptionKeyLength(128);
            document.protect(policy);
            return TestPdfs.save(document);
        }
    }
}
