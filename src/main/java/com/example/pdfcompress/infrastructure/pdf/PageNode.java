package com.example.pdfcompress.infrastructure.pdf;

import org.apache.pdfbox.cos.COSDictionary;

import java.util.Optional;

/**
 * A leaf of the page tree together with its effective resource dictionary.
 *
 * @param index      zero-based position in document order
 * @param dictionary the page dictionary itself
 * @param resources  own or inherited resource dictionary; empty when none resolves
 */
public record PageNode(int index, COSDictionary dictionary, Optional<COSDictionary> resources) {
}
