package org.dependencytrack.cvss.vector;

import org.jspecify.annotations.Nullable;

public final class UnsupportedVersionException extends InvalidVectorException {

    private final String tag;

    UnsupportedVersionException(final @Nullable String tag) {
        super(tag == null || tag.isBlank()
                ? "Vector does not start with a version tag"
                : "Unsupported version tag %s; expected CVSS:3.1 or CVSS:4.0".formatted(tag));
        this.tag = tag;
    }

    /**
     * @return The leading segment that was found in place of a supported version tag
     */
    public @Nullable String getTag() {
        return tag;
    }

}
