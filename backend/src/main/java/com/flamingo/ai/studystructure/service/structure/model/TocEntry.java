package com.flamingo.ai.studystructure.service.structure.model;

/**
 * One bookmark of the document outline, flattened in document order.
 *
 * @param title bookmark title
 * @param pageNumber 1-based target page; 1 when the bookmark has no resolvable destination
 * @param level nesting depth, 0 for top-level (chapter) entries
 * @param id {@code toc-<n>} where n is the entry's position in the flattened list
 */
public record TocEntry(String title, int pageNumber, int level, String id) {}
