package com.statementradar.domain;

/**
 * Human-facing bucket for an extraction confidence score.
 */
public enum ConfidenceLevel {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String label;

    ConfidenceLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** HIGH at 0.9 and above, MEDIUM at 0.7 and above, LOW otherwise. */
    public static ConfidenceLevel of(double confidence) {
        if (confidence >= 0.9) {
            return HIGH;
        }
        if (confidence >= 0.7) {
            return MEDIUM;
        }
        return LOW;
    }
}
