package com.statementradar.domain;

/**
 * One rendered page of a source document. Page numbers are 1-based.
 */
public record Page(int pageNum, String text, PageImage image) {

    public static Page textOnly(int pageNum, String text) {
        return new Page(pageNum, text, null);
    }

    public boolean hasImage() {
        return image != null && !image.isEmpty();
    }

    /** Length of the text after trimming; 0 when the page has no text. */
    public int trimmedTextLength() {
        return text == null ? 0 : text.trim().length();
    }
}
