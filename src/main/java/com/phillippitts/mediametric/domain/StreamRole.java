package com.phillippitts.mediametric.domain;

/**
 * Role of a stream within an asset.
 */
public enum StreamRole {
    REFERENCE("ref"),
    DISTORTED("dis");

    private final String tag;

    StreamRole(String tag) {
        this.tag = tag;
    }

    /**
     * Short tag used in derived file names and side-artifact suffixes.
     */
    public String tag() {
        return tag;
    }

    /**
     * Suffix identifying a retained side artifact of this role in the result cache.
     */
    public String artifactSuffix() {
        return "_" + tag;
    }
}
