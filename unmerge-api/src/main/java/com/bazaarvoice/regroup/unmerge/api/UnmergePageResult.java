package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

/**
 * Outcome of one page of an unmerge run.  Unless the page finished the run it names the reference of the page that
 * continues it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class UnmergePageResult {
    private final int _eventsMoved;
    private final int _eventsKept;
    private final String _nextReference;

    @JsonCreator
    public UnmergePageResult(@JsonProperty("eventsMoved") int eventsMoved,
                             @JsonProperty("eventsKept") int eventsKept,
                             @JsonProperty("nextReference") @Nullable String nextReference) {
        _eventsMoved = eventsMoved;
        _eventsKept = eventsKept;
        _nextReference = nextReference;
    }

    public int getEventsMoved() {
        return _eventsMoved;
    }

    public int getEventsKept() {
        return _eventsKept;
    }

    @Nullable
    public String getNextReference() {
        return _nextReference;
    }

    @JsonIgnore
    public boolean isFinished() {
        return _nextReference == null;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("eventsMoved", _eventsMoved)
                .add("eventsKept", _eventsKept)
                .add("nextReference", _nextReference)
                .omitNullValues()
                .toString();
    }
}
