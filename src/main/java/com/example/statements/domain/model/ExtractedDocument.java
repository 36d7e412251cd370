package com.example.statements.domain.model;

import java.util.List;

/**
 * Page-ordered text of a PDF.
 *
 * @param pages one entry per page, empty strings for pages without text
 */
public record ExtractedDocument(List<String> pages) {

    private static final ExtractedDocument EMPTY = new ExtractedDocument(List.of());

    public ExtractedDocument {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    public static ExtractedDocument empty() {
        return EMPTY;
    }

    /**
     * Wraps free text (OCR output, tests) as a single page.
     *
     * @param text page text
     * @return single page document
     */
    public static ExtractedDocument ofText(String text) {
        return new ExtractedDocument(List.of(text == null ? "" : text));
    }

    public int pageCount() {
        return pages.size();
    }

    /**
     * @return every page joined with a line feed, in page order
     */
    public String text() {
        return String.join("\n", pages);
    }

    /**
     * @param count maximum number of pages to include
     * @return concatenated text of the leading pages
     */
    public String firstPages(int count) {
        return String.join("", pages.subList(0, Math.min(Math.max(count, 0), pages.size())));
    }
}
