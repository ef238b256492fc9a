package org.dependencytrack.cvss.vector;

public final class MalformedSegmentException extends InvalidVectorException {

    private final String segment;

    MalformedSegmentException(final String segment) {
        super("Malformed segment \"%s\"; expected KEY:VALUE".formatted(segment));
        this.segment = segment;
    }

    public String getSegment() {
        return segment;
    }

}
