package org.dependencytrack.cvss.api;

import java.util.Optional;

public enum Version {

    V3_1("3.1"),
    V4_0("4.0");

    private static final String TAG_PREFIX = "CVSS:";

    private final String number;

    Version(final String number) {
        this.number = number;
    }

    public String number() {
        return number;
    }

    /**
     * @return The tag that leads every vector of this version, e.g. {@code CVSS:3.1}
     */
    public String tag() {
        return TAG_PREFIX + number;
    }

    public static Optional<Version> ofTag(final String tag) {
        if (tag == null) {
            return Optional.empty();
        }

        for (final Version version : values()) {
            if (version.tag().equals(tag)) {
                return Optional.of(version);
            }
        }

        return Optional.empty();
    }

}
