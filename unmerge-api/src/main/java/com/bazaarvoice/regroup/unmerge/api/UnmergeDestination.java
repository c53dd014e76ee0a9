package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The group events for one unmerge key are moved into, along with the opaque state of the event stream unmerge
 * opened for it.  The stream state is null until the stream has been started.
 */
public final class UnmergeDestination {
    private final String _groupId;
    private final Map<String, Object> _streamState;

    @JsonCreator
    public UnmergeDestination(@JsonProperty("groupId") String groupId,
                              @JsonProperty("streamState") @Nullable Map<String, Object> streamState) {
        _groupId = checkNotNull(groupId, "groupId");
        _streamState = streamState != null ? ImmutableMap.copyOf(streamState) : null;
    }

    public String getGroupId() {
        return _groupId;
    }

    @Nullable
    public Map<String, Object> getStreamState() {
        return _streamState;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnmergeDestination)) {
            return false;
        }
        UnmergeDestination that = (UnmergeDestination) o;
        return _groupId.equals(that._groupId) && Objects.equals(_streamState, that._streamState);
    }

    @Override
    public int hashCode() {
        return Objects.hash(_groupId, _streamState);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("groupId", _groupId)
                .add("streamState", _streamState)
                .omitNullValues()
                .toString();
    }
}
