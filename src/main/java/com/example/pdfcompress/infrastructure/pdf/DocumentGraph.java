package com.example.pdfcompress.infrastructure.pdf;

import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSNull;
import org.apache.pdfbox.cos.COSObject;
import org.apache.pdfbox.cos.COSStream;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The indirect-object graph of one loaded document.
 * <p>
 * Owned by exactly one compression request and closed when that request ends. All reference
 * resolution goes through this class and never throws: a dangling reference, a {@code null}
 * value and an explicit {@code null} object all resolve to {@link Optional#empty()}.
 * </p>
 */
public final class DocumentGraph implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(DocumentGraph.class);
    private static final int MAX_REFERENCE_HOPS = 32;

    private final PDDocument document;

    public DocumentGraph(PDDocument document) {
        this.document = Objects.requireNonNull(document, "document");
    }

    /**
     * @return the underlying PDFBox document, needed by the writer and the image encoder
     */
    public PDDocument document() {
        return document;
    }

    public COSDictionary trailer() {
        return document.getDocument().getTrailer();
    }

	/**
	 * Resolves the trailer's {@code Root} entry.
	 *
	 * @return the catalog dictionary or empty when the root reference dangles
	 */
    public Optional<COSDictionary> catalog() {
        COSDictionary trailer = trailer();
        return trailer != null ? resolveDictionary(trailer.getItem(COSName.ROOT)) : Optional.empty();
    }

	/**
	 * Follows references until a direct value is reached.
	 *
	 * @param value direct value or reference, may be {@code null}
	 * @return the resolved value, or empty when the target is missing
	 */
    public Optional<COSBase> resolve(COSBase value) {
        COSBase current = value;
        int hops = 0;
        while (current instanceof COSObject reference) {
            if (++hops > MAX_REFERENCE_HOPS) {
                log.warn("Reference chain longer than {} hops; treating {} as missing", MAX_REFERENCE_HOPS, value);
                return Optional.empty();
            }
            current = reference.getObject();
        }
        if (current == null || current instanceof COSNull) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

	/**
	 * Resolves a value that is expected to be a plain dictionary. Streams do not qualify.
	 *
	 * @param value direct value or reference
	 * @return the dictionary, or empty when missing or of another type
	 */
    public Optional<COSDictionary> resolveDictionary(COSBase value) {
        return resolve(value)
                .filter(resolved -> resolved instanceof COSDictionary && !(resolved instanceof COSStream))
                .map(COSDictionary.class::cast);
    }

    public Optional<COSStream> resolveStream(COSBase value) {
        return resolve(value)
                .filter(COSStream.class::isInstance)
                .map(COSStream.class::cast);
    }

    public Optional<COSArray> resolveArray(COSBase value) {
        return resolve(value)
                .filter(COSArray.class::isInstance)
                .map(COSArray.class::cast);
    }

	/**
	 * Walks {@code Catalog -> Pages -> Kids} and returns every leaf page in document order.
	 * Inheritable resources are carried down from intermediate nodes. A node reached twice
	 * (a cycle or a shared subtree) is only visited once.
	 *
	 * @return the pages that could be resolved; malformed branches are skipped
	 */
    public List<PageNode> pages() {
        List<PageNode> pages = new ArrayList<>();
        Optional<COSDictionary> root = catalog()
                .flatMap(catalog -> resolveDictionary(catalog.getItem(COSName.PAGES)));
        if (root.isEmpty()) {
            return pages;
        }
        Set<COSDictionary> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<PendingNode> pending = new ArrayDeque<>();
        pending.push(new PendingNode(root.get(), null));

        while (!pending.isEmpty()) {
            PendingNode current = pending.pop();
            COSDictionary node = current.node();
            if (!visited.add(node)) {
                log.warn("Page tree node visited twice; skipping the repeated branch");
                continue;
            }
            COSDictionary resources = resolveDictionary(node.getItem(COSName.RESOURCES))
                    .orElse(current.inheritedResources());
            Optional<COSArray> kids = resolveArray(node.getItem(COSName.KIDS));

            if (!isIntermediateNode(node, kids)) {
                pages.add(new PageNode(pages.size(), node, Optional.ofNullable(resources)));
                continue;
            }
            // pushed in reverse so the first kid is popped first
            COSArray children = kids.orElseGet(COSArray::new);
            for (int i = children.size() - 1; i >= 0; i--) {
                resolveDictionary(children.get(i))
                        .ifPresent(child -> pending.push(new PendingNode(child, resources)));
            }
        }
        return pages;
    }

    private boolean isIntermediateNode(COSDictionary node, Optional<COSArray> kids) {
        COSName type = node.getCOSName(COSName.TYPE);
        if (COSName.PAGES.equals(type)) {
            return true;
        }
        return type == null && kids.isPresent();
    }

    private record PendingNode(COSDictionary node, COSDictionary inheritedResources) {
    }

    /**
     * Releases the document. A failure to close is logged; the request outcome is already decided by then.
     */
    @Override
    public void close() {
        try {
            document.close();
        } catch (IOException ex) {
            log.warn("Failed to close document graph", ex);
        }
    }
}
