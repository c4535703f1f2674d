package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.infrastructure.pdf.DocumentGraph;
import com.example.pdfcompress.infrastructure.pdf.PageNode;

import org.apache.pdfbox.cos.COSDictionary;
import org.apache.pdfbox.cos.COSName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Optional;
import java.util.Set;

/**
 * Removes non-essential entries from resolved dictionaries according to {@link PruningRule}.
 * Every operation is idempotent: absent keys and unresolvable targets are simply nothing to prune.
 */
@Service
public class GraphPruner {

    private static final Logger log = LoggerFactory.getLogger(GraphPruner.class);

	/**
	 * Removes {@code key} from {@code node}.
	 *
	 * @param node resolved dictionary, {@code null} is treated as nothing to prune
	 * @param key  entry to remove
	 * @return whether an entry was actually removed
	 */
    public boolean deleteIfPresent(COSDictionary node, COSName key) {
        if (node == null || !node.containsKey(key)) {
            return false;
        }
        node.removeItem(key);
        return true;
    }

	/**
	 * Applies one rule to every node it targets in the graph.
	 *
	 * @param graph   graph being compressed
	 * @param rule    rule from the policy table
	 * @param options request options deciding whether the rule applies
	 * @return number of entries removed
	 */
    public int prune(DocumentGraph graph, PruningRule rule, CompressionOptions options) {
        if (!rule.appliesTo(options)) {
            return 0;
        }
        int removed = switch (rule.target()) {
            case TRAILER -> pruneNode(graph.trailer(), rule);
            case CATALOG -> graph.catalog().map(catalog -> pruneNode(catalog, rule)).orElse(0);
            case NAME_DICTIONARY -> nameDictionary(graph).map(names -> pruneNode(names, rule)).orElse(0);
            case PAGE -> graph.pages().stream().mapToInt(page -> pruneNode(page.dictionary(), rule)).sum();
            case RESOURCES -> pruneResources(graph, rule);
        };
        if (removed > 0) {
            log.debug("Rule {} removed {} entries", rule, removed);
        }
        return removed;
    }

	/**
	 * Applies every rule of the policy table, in declaration order.
	 *
	 * @param graph   graph being compressed
	 * @param options request options
	 * @return number of entries removed
	 */
    public int pruneAll(DocumentGraph graph, CompressionOptions options) {
        int removed = 0;
        for (PruningRule rule : PruningRule.values()) {
            removed += prune(graph, rule, options);
        }
        return removed;
    }

    private int pruneNode(COSDictionary node, PruningRule rule) {
        int removed = 0;
        for (COSName key : rule.keys()) {
            if (deleteIfPresent(node, key)) {
                removed++;
            }
        }
        return removed;
    }

    private int pruneResources(DocumentGraph graph, PruningRule rule) {
        Set<COSDictionary> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        int removed = 0;
        for (PageNode page : graph.pages()) {
            Optional<COSDictionary> resources = page.resources();
            if (resources.isPresent() && seen.add(resources.get())) {
                removed += pruneNode(resources.get(), rule);
            }
        }
        return removed;
    }

    private Optional<COSDictionary> nameDictionary(DocumentGraph graph) {
        return graph.catalog().flatMap(catalog -> graph.resolveDictionary(catalog.getItem(COSName.NAMES)));
    }
}
