package com.bazaarvoice.regroup.unmerge.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One page of a group's events in insertion order.  The next cursor is null once the group has no events past
 * this page.
 */
public final class EventPage {
    private final List<Event> _events;
    private final String _nextCursor;

    @JsonCreator
    public EventPage(@JsonProperty("events") List<Event> events,
                     @JsonProperty("nextCursor") @Nullable String nextCursor) {
        _events = ImmutableList.copyOf(checkNotNull(events, "events"));
        _nextCursor = nextCursor;
    }

    public List<Event> getEvents() {
        return _events;
    }

    @Nullable
    public String getNextCursor() {
        return _nextCursor;
    }

    public boolean isExhausted() {
        return _nextCursor == null;
    }
}
