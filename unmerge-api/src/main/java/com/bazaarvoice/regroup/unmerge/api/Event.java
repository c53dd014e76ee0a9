package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single event as read from the analytics index.  The primary hash is the event's deduplication fingerprint.
 * Hierarchical hashes, when present, are ordered from the broadest grouping (index 0) to the most specific.
 */
public final class Event {
    private final String _eventId;
    private final String _projectId;
    private final String _groupId;
    private final String _primaryHash;
    private final List<String> _hierarchicalHashes;
    private final Instant _timestamp;

    @JsonCreator
    public Event(@JsonProperty("eventId") String eventId,
                 @JsonProperty("projectId") String projectId,
                 @JsonProperty("groupId") String groupId,
                 @JsonProperty("primaryHash") String primaryHash,
                 @JsonProperty("hierarchicalHashes") @Nullable List<String> hierarchicalHashes,
                 @JsonProperty("timestamp") Instant timestamp) {
        _eventId = checkNotNull(eventId, "eventId");
        _projectId = checkNotNull(projectId, "projectId");
        _groupId = checkNotNull(groupId, "groupId");
        _primaryHash = checkNotNull(primaryHash, "primaryHash");
        _hierarchicalHashes = knownLevels(hierarchicalHashes);
        _timestamp = checkNotNull(timestamp, "timestamp");
    }

    /**
     * Older events may have gaps in their hierarchy.  Levels past the first missing one can't be matched by position,
     * so the sequence ends there.
     */
    private static List<String> knownLevels(@Nullable List<String> hierarchicalHashes) {
        if (hierarchicalHashes == null) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<String> levels = ImmutableList.builder();
        for (String hash : hierarchicalHashes) {
            if (hash == null) {
                break;
            }
            levels.add(hash);
        }
        return levels.build();
    }

    public String getEventId() {
        return _eventId;
    }

    public String getProjectId() {
        return _projectId;
    }

    public String getGroupId() {
        return _groupId;
    }

    public String getPrimaryHash() {
        return _primaryHash;
    }

    /** Returns the hierarchical hash sequence, empty for events which were grouped without one. */
    public List<String> getHierarchicalHashes() {
        return _hierarchicalHashes;
    }

    public Instant getTimestamp() {
        return _timestamp;
    }

    /** Returns a copy of this event which belongs to a different group. */
    public Event withGroupId(String groupId) {
        return new Event(_eventId, _projectId, groupId, _primaryHash, _hierarchicalHashes, _timestamp);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event)) {
            return false;
        }
        Event event = (Event) o;
        return _eventId.equals(event._eventId) &&
                _projectId.equals(event._projectId) &&
                _groupId.equals(event._groupId) &&
                _primaryHash.equals(event._primaryHash) &&
                _hierarchicalHashes.equals(event._hierarchicalHashes) &&
                _timestamp.equals(event._timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_eventId, _projectId, _groupId);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("eventId", _eventId)
                .add("groupId", _groupId)
                .add("primaryHash", _primaryHash)
                .toString();
    }
}
