package com.statementradar.domain;

import java.util.Base64;

/**
 * Rendered page image handed over by the document renderer.
 */
public record PageImage(String mediaType, byte[] data) {

    public boolean isEmpty() {
        return data == null || data.length == 0;
    }

    public String base64() {
        return data == null ? "" : Base64.getEncoder().encodeToString(data);
    }
}
