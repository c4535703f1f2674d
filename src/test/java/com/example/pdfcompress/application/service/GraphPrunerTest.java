package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionLevel;
import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.infrastructure.pdf.DocumentGraph;
import com.example.pdfcompress.infrastructure.pdf.PageNode;
import com.example.pdfcompress.support.TestPdfs;

import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Set;

import static com.example.pdfcompress.support.TestPdfs.name;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the pruning table and its idempotence.
 */
class GraphPrunerTest {

    private final GraphPruner pruner = new GraphPruner();

    @Test
    void deleteIfPresentReportsWhetherAnythingWasRemoved() {
        COSDictionary node = new COSDictionary();
        node.setInt(name("StructParents"), 1);

        assertThat(pruner.deleteIfPresent(node, name("StructParents"))).isTrue();
        assertThat(pruner.deleteIfPresent(node, name("StructParents"))).isFalse();
        assertThat(pruner.deleteIfPresent(null, name("StructParents"))).isFalse();
    }

    @Test
    void lowLevelRemovesOnlyTheAlwaysEntries() throws IOException {
        try (DocumentGraph graph = new DocumentGraph(TestPdfs.richDocument())) {
            pruner.pruneAll(graph, new CompressionOptions(80, CompressionLevel.LOW, false));

            COSDictionary catalog = graph.catalog().orElseThrow();
            assertThat(catalog.containsKey(name("Metadata"))).isFalse();
            assertThat(catalog.containsKey(name("Outlines"))).isFalse();
            assertThat(catalog.containsKey(name("MarkInfo"))).isFalse();
            assertThat(catalog.containsKey(name("PageMode"))).isFalse();
            assertThat(catalog.containsKey(name("StructTreeRoot"))).isTrue();
            assertThat(catalog.containsKey(name("OCProperties"))).isTrue();
            assertThat(graph.trailer().containsKey(COSName.INFO)).isFalse();

            COSDictionary names = catalog.getCOSDictionary(COSName.NAMES);
            assertThat(names.containsKey(name("EmbeddedFiles"))).isFalse();
            assertThat(names.containsKey(name("Dests"))).isTrue();

            for (PageNode page : graph.pages()) {
                assertThat(page.dictionary().containsKey(name("Thumb"))).isFalse();
                assertThat(page.dictionary().containsKey(COSName.ANNOTS)).isTrue();
                assertThat(page.dictionary().containsKey(name("Trans"))).isTrue();
                assertThat(page.resources().orElseThrow().containsKey(name("ProcSet"))).isTrue();
            }
        }
    }

    @Test
    void highLevelWithPreserveQualityKeepsAnnotationsAndProcSets() throws IOException {
        try (DocumentGraph graph = new DocumentGraph(TestPdfs.richDocument())) {
            pruner.pruneAll(graph, new CompressionOptions(50, CompressionLevel.HIGH, true));

            COSDictionary catalog = graph.catalog().orElseThrow();
            assertThat(catalog.containsKey(name("StructTreeRoot"))).isFalse();
            assertThat(catalog.containsKey(name("OCProperties"))).isFalse();
            for (PageNode page : graph.pages()) {
                assertThat(page.dictionary().containsKey(name("Trans"))).isFalse();
                assertThat(page.dictionary().containsKey(name("StructParents"))).isFalse();
                assertThat(page.dictionary().containsKey(name("Tabs"))).isFalse();
                assertThat(page.dictionary().containsKey(COSName.ANNOTS)).isTrue();
                assertThat(page.resources().orElseThrow().containsKey(name("ProcSet"))).isTrue();
            }
        }
    }

    @Test
    void highLevelWithoutPreserveQualityRemovesAnnotationsAndProcSets() throws IOException {
        try (DocumentGraph graph = new DocumentGraph(TestPdfs.richDocument())) {
            int removed = pruner.pruneAll(graph, new CompressionOptions(50, CompressionLevel.HIGH, false));

            assertThat(removed).isPositive();
            for (PageNode page : graph.pages()) {
                assertThat(page.dictionary().containsKey(COSName.ANNOTS)).isFalse();
                assertThat(page.resources().orElseThrow().containsKey(name("ProcSet"))).isFalse();
            }
            assertThat(graph.trailer().containsKey(COSName.ROOT)).isTrue();
            assertThat(graph.catalog()).isPresent();
        }
    }

    @Test
    void pruningTwiceChangesNothingTheSecondTime() throws IOException {
        CompressionOptions options = new CompressionOptions(20, CompressionLevel.HIGH, false);
        try (DocumentGraph graph = new DocumentGraph(TestPdfs.richDocument())) {
            int first = pruner.pruneAll(graph, options);
            Set<COSName> catalogKeys = Set.copyOf(graph.catalog().orElseThrow().keySet());
            Set<COSName> pageKeys = Set.copyOf(graph.pages().get(0).dictionary().keySet());

            int second = pruner.pruneAll(graph, options);

            assertThat(first).isPositive();
            assertThat(second).isZero();
            assertThat(graph.catalog().orElseThrow().keySet()).containsExactlyInAnyOrderElementsOf(catalogKeys);
            assertThat(graph.pages().get(0).dictionary().keySet()).containsExactlyInAnyOrderElementsOf(pageKeys);
        }
    }

    @Test
    void ruleThatDoesNotApplyRemovesNothing() throws IOException {
        try (DocumentGraph graph = new DocumentGraph(TestPdfs.richDocument())) {
            int removed = pruner.prune(graph, PruningRule.CATALOG_STRUCTURE,
                    new CompressionOptions(50, CompressionLevel.MEDIUM, false));

            assertThat(removed).isZero();
            assertThat(graph.catalog().orElseThrow().containsKey(name("StructTreeRoot"))).isTrue();
        }
    }
}
