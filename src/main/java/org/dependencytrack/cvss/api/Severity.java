package org.dependencytrack.cvss.api;

public enum Severity {

    NONE("None"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    Severity(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Qualitative rating of a score, shared by CVSS v3.1 and v4.0.
     * <p>
     * Bands are half-open; a score sitting exactly on a boundary belongs to the higher band.
     *
     * @param score The score, in the range {@code [0, 10]}
     * @return The {@link Severity} band the score falls into
     * @throws IllegalArgumentException When the score is outside of {@code [0, 10]}
     */
    public static Severity ofScore(final double score) {
        if (Double.isNaN(score) || score < 0 || score > 10) {
            throw new IllegalArgumentException("Score must be within [0, 10], but is " + score);
        }

        if (score >= 9) {
            return CRITICAL;
        } else if (score >= 7) {
            return HIGH;
        } else if (score >= 4) {
            return MEDIUM;
        } else if (score > 0) {
            return LOW;
        } else {
            return NONE;
        }
    }

}
