package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The classic unmerge: every event whose primary hash is one of the fingerprints moves into a single new group.
 */
@JsonTypeName("primary-hash")
public final class PrimaryHashUnmergeReplacement implements UnmergeReplacement {

    /** The only unmerge key produced by this replacement. */
    public static final String DEFAULT_UNMERGE_KEY = "default";

    private final Set<String> _fingerprints;

    @JsonCreator
    public PrimaryHashUnmergeReplacement(@JsonProperty("fingerprints") Collection<String> fingerprints) {
        checkNotNull(fingerprints, "fingerprints");
        checkArgument(!fingerprints.isEmpty(), "At least one fingerprint is required");
        _fingerprints = ImmutableSet.copyOf(fingerprints);
    }

    public Set<String> getFingerprints() {
        return _fingerprints;
    }

    @Override
    public <T> T visit(UnmergeReplacementVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        return this == o ||
                (o instanceof PrimaryHashUnmergeReplacement &&
                        _fingerprints.equals(((PrimaryHashUnmergeReplacement) o)._fingerprints));
    }

    @Override
    public int hashCode() {
        return _fingerprints.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("fingerprints", _fingerprints)
                .toString();
    }
}
