package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Ownership record of a single hash within a project: the group which events with this hash are routed to.
 */
public final class HashLockEntry {
    private final String _projectId;
    private final String _hash;
    private final String _groupId;
    private final HashState _state;

    @JsonCreator
    public HashLockEntry(@JsonProperty("projectId") String projectId,
                         @JsonProperty("hash") String hash,
                         @JsonProperty("groupId") String groupId,
                         @JsonProperty("state") HashState state) {
        _projectId = checkNotNull(projectId, "projectId");
        _hash = checkNotNull(hash, "hash");
        _groupId = checkNotNull(groupId, "groupId");
        _state = checkNotNull(state, "state");
    }

    public String getProjectId() {
        return _projectId;
    }

    public String getHash() {
        return _hash;
    }

    public String getGroupId() {
        return _groupId;
    }

    public HashState getState() {
        return _state;
    }

    public HashLockEntry withGroupId(String groupId) {
        return new HashLockEntry(_projectId, _hash, groupId, _state);
    }

    public HashLockEntry withState(HashState state) {
        return new HashLockEntry(_projectId, _hash, _groupId, state);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HashLockEntry)) {
            return false;
        }
        HashLockEntry that = (HashLockEntry) o;
        return _projectId.equals(that._projectId) &&
                _hash.equals(that._hash) &&
                _groupId.equals(that._groupId) &&
                _state == that._state;
    }

    @Override
    public int hashCode() {
        return Objects.hash(_projectId, _hash, _groupId, _state);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("projectId", _projectId)
                .add("hash", _hash)
                .add("groupId", _groupId)
                .add("state", _state)
                .toString();
    }
}
