package com.bazaarvoice.regroup.unmerge.api;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Arguments for a page of a run which has not moved any events yet.  Destinations are normally empty; they are only
 * supplied up front when the caller wants events merged into an existing group.  The cursor is set when earlier
 * pages were scanned without finding an event to move.
 */
public final class InitialUnmergeArgs extends UnmergeArgs {

    public InitialUnmergeArgs(String runId, String projectId, String sourceId, UnmergeReplacement replacement,
                              @Nullable String actorId, int batchSize) {
        this(runId, projectId, sourceId, replacement, actorId, batchSize, ImmutableMap.of(), null);
    }

    public InitialUnmergeArgs(String runId, String projectId, String sourceId, UnmergeReplacement replacement,
                              @Nullable String actorId, int batchSize, Map<String, UnmergeDestination> destinations,
                              @Nullable String cursor) {
        super(runId, projectId, sourceId, replacement, actorId, batchSize, destinations, cursor);
    }

    /** Returns the arguments for scanning the page which starts at the given cursor. */
    public InitialUnmergeArgs withCursor(String cursor) {
        return new InitialUnmergeArgs(getRunId(), getProjectId(), getSourceId(), getReplacement(), getActorId(),
                getBatchSize(), getDestinations(), cursor);
    }

    @Override
    public <T> T visit(UnmergeArgsVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("runId", getRunId())
                .add("projectId", getProjectId())
                .add("sourceId", getSourceId())
                .add("replacement", getReplacement())
                .add("cursor", getCursor())
                .omitNullValues()
                .toString();
    }
}
