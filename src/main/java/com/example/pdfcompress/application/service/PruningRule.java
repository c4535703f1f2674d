package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionOptions;

import org.apache.pdfbox.cos.COSName;

import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Policy table of the entries removed from the document graph.
 * Each rule names the node it targets, the keys it removes and the options under which it applies.
 */
public enum PruningRule {

    CATALOG_METADATA(Target.CATALOG, options -> true,
            "Metadata", "MarkInfo", "Outlines", "PageLabels", "ViewerPreferences",
            "PageLayout", "PageMode", "Threads", "OpenAction"),
    CATALOG_EMBEDDED_FILES(Target.NAME_DICTIONARY, options -> true,
            "EmbeddedFiles"),
    CATALOG_STRUCTURE(Target.CATALOG, CompressionOptions::isHigh,
            "StructTreeRoot", "OCProperties"),
    TRAILER_INFO(Target.TRAILER, options -> true,
            "Info"),
    PAGE_THUMBNAIL(Target.PAGE, options -> true,
            "Thumb"),
    PAGE_ANNOTATIONS(Target.PAGE, CompressionOptions::allowsLossyPruning,
            "Annots"),
    PAGE_INTERACTIVITY(Target.PAGE, CompressionOptions::isHigh,
            "Dur", "Trans", "AA", "StructParents", "PZ", "SeparationInfo", "Group",
            "Tabs", "TemplateInstantiated", "PresSteps", "UserUnit"),
    RESOURCE_PROC_SET(Target.RESOURCES, CompressionOptions::allowsLossyPruning,
            "ProcSet");

    private final Target target;
    private final Predicate<CompressionOptions> condition;
    private final List<COSName> keys;

    PruningRule(Target target, Predicate<CompressionOptions> condition, String... keys) {
        this.target = target;
        this.condition = condition;
        this.keys = Arrays.stream(keys).map(COSName::getPDFName).toList();
    }

    public Target target() {
        return target;
    }

    public List<COSName> keys() {
        return keys;
    }

    public boolean appliesTo(CompressionOptions options) {
        return condition.test(options);
    }

    /**
     * Kind of node a rule is applied to.
     */
    public enum Target {
        TRAILER,
        CATALOG,
        /** the dictionary behind the catalog's {@code Names} entry */
        NAME_DICTIONARY,
        PAGE,
        /** effective resource dictionary of each page */
        RESOURCES
    }
}
