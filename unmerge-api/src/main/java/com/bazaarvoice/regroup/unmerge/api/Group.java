package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.time.Instant;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A group's denormalized summary fields, as kept by the primary event store.
 */
public final class Group {
    private final String _projectId;
    private final String _groupId;
    private final Instant _firstSeen;
    private final Instant _lastSeen;
    private final long _timesSeen;

    @JsonCreator
    public Group(@JsonProperty("projectId") String projectId,
                 @JsonProperty("groupId") String groupId,
                 @JsonProperty("firstSeen") @Nullable Instant firstSeen,
                 @JsonProperty("lastSeen") @Nullable Instant lastSeen,
                 @JsonProperty("timesSeen") long timesSeen) {
        _projectId = checkNotNull(projectId, "projectId");
        _groupId = checkNotNull(groupId, "groupId");
        _firstSeen = firstSeen;
        _lastSeen = lastSeen;
        _timesSeen = timesSeen;
    }

    public String getProjectId() {
        return _projectId;
    }

    public String getGroupId() {
        return _groupId;
    }

    @Nullable
    public Instant getFirstSeen() {
        return _firstSeen;
    }

    @Nullable
    public Instant getLastSeen() {
        return _lastSeen;
    }

    public long getTimesSeen() {
        return _timesSeen;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("projectId", _projectId)
                .add("groupId", _groupId)
                .add("firstSeen", _firstSeen)
                .add("lastSeen", _lastSeen)
                .add("timesSeen", _timesSeen)
                .toString();
    }
}
