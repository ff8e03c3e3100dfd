package com.raditha.bytelift.model;

/**
 * A best-effort pointer back to the original source.
 *
 * @param document source file name as recorded in the debug symbols
 * @param line     1-based line number
 */
public record SourceHint(String document, int line) {
}
