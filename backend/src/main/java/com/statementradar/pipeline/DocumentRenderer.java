package com.statementradar.pipeline;

import com.statementradar.domain.Page;

import java.util.List;

/**
 * Renders a source document into pages with image and text. PDF decoding, DPI and OCR live behind this port.
 *
 * @param <S> source document handle (path, bytes, upload, ...)
 */
@FunctionalInterface
public interface DocumentRenderer<S> {

    List<Page> render(S source);
}
