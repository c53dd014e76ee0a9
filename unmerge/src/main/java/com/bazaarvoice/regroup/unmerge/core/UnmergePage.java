package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.unmerge.api.UnmergeArgs;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

/**
 * What one run of a page did and, unless the run is over, the arguments for the next page.
 */
public class UnmergePage {

    private final UnmergeArgs _successor;
    private final int _eventsMoved;
    private final int _eventsKept;

    private UnmergePage(@Nullable UnmergeArgs successor, int eventsMoved, int eventsKept) {
        _successor = successor;
        _eventsMoved = eventsMoved;
        _eventsKept = eventsKept;
    }

    static UnmergePage next(UnmergeArgs successor, int eventsMoved, int eventsKept) {
        return new UnmergePage(successor, eventsMoved, eventsKept);
    }

    static UnmergePage finished(int eventsMoved, int eventsKept) {
        return new UnmergePage(null, eventsMoved, eventsKept);
    }

    @Nullable
    public UnmergeArgs getSuccessor() {
        return _successor;
    }

    public boolean isFinished() {
        return _successor == null;
    }

    public int getEventsMoved() {
        return _eventsMoved;
    }

    /** Events folded back into the source group's fields by this page. */
    public int getEventsKept() {
        return _eventsKept;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("successor", _successor)
                .add("eventsMoved", _eventsMoved)
                .add("eventsKept", _eventsKept)
                .omitNullValues()
                .toString();
    }
}
