package com.statementradar.domain;

/**
 * Result of one arithmetic identity check during consolidation. A failed check is a warning, not an error.
 */
public record ValidationCheck(String name, boolean passed, String detail) {

    public static ValidationCheck passed(String name, String detail) {
        return new ValidationCheck(name, true, detail);
    }

    public static ValidationCheck failed(String name, String detail) {
        return new ValidationCheck(name, false, detail);
    }
}
