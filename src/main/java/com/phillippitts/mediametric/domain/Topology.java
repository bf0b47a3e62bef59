package com.phillippitts.mediametric.domain;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which stream roles a computation consumes.
 *
 * <p>Every stage, wait and validation step of the per-asset pipeline iterates over
 * {@link #roles()}, so a no-reference computation never touches a reference stream.
 */
public enum Topology {
    FULL_REFERENCE(EnumSet.of(StreamRole.REFERENCE, StreamRole.DISTORTED)),
    NO_REFERENCE(EnumSet.of(StreamRole.DISTORTED));

    private final Set<StreamRole> roles;

    Topology(EnumSet<StreamRole> roles) {
        this.roles = Collections.unmodifiableSet(roles);
    }

    /**
     * Required roles, in declaration order (reference first).
     */
    public Set<StreamRole> roles() {
        return roles;
    }

    public boolean requires(StreamRole role) {
        return roles.contains(role);
    }
}
