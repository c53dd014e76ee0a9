package com.bazaarvoice.regroup.unmerge.api;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Arguments for a page of a run which has found at least one event to move.  Mutations start here: destinations are
 * created, the source group's fields are reset once and events are moved page by page.
 */
public final class SuccessiveUnmergeArgs extends UnmergeArgs {

    private final Set<String> _lockedPrimaryHashes;
    private final boolean _sourceFieldsReset;

    public SuccessiveUnmergeArgs(String runId, String projectId, String sourceId, UnmergeReplacement replacement,
                                 @Nullable String actorId, int batchSize,
                                 Map<String, UnmergeDestination> destinations, @Nullable String cursor,
                                 Collection<String> lockedPrimaryHashes, boolean sourceFieldsReset) {
        super(runId, projectId, sourceId, replacement, actorId, batchSize, destinations, cursor);
        checkArgument(!destinations.isEmpty(), "A successive page requires at least one destination");
        _lockedPrimaryHashes = ImmutableSet.copyOf(checkNotNull(lockedPrimaryHashes, "lockedPrimaryHashes"));
        _sourceFieldsReset = sourceFieldsReset;
    }

    /** Hashes locked by the run's first page.  Empty for replacements which lock nothing. */
    public Set<String> getLockedPrimaryHashes() {
        return _lockedPrimaryHashes;
    }

    /** True once the source group's fields were reset from the events which stay in it. */
    public boolean isSourceFieldsReset() {
        return _sourceFieldsReset;
    }

    @Override
    public <T> T visit(UnmergeArgsVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) {
            return false;
        }
        SuccessiveUnmergeArgs that = (SuccessiveUnmergeArgs) o;
        return _sourceFieldsReset == that._sourceFieldsReset &&
                _lockedPrimaryHashes.equals(that._lockedPrimaryHashes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), _sourceFieldsReset);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("runId", getRunId())
                .add("projectId", getProjectId())
                .add("sourceId", getSourceId())
                .add("replacement", getReplacement())
                .add("cursor", getCursor())
                .add("destinations", getDestinations())
                .add("lockedPrimaryHashes", _lockedPrimaryHashes.size())
                .add("sourceFieldsReset", _sourceFieldsReset)
                .omitNullValues()
                .toString();
    }
}
