package com.bazaarvoice.regroup.unmerge.api;

import javax.annotation.Nullable;

/**
 * Paginated reads of a group's events from the analytics index.
 */
public interface EventSource {

    /**
     * Returns up to {@code limit} events of the group which follow the cursor, in insertion order.  Paging with the
     * returned cursor never re-delivers or skips an event.
     * @param cursor The cursor returned with the previous page, or null to start at the beginning of the group.
     */
    EventPage fetchPage(String projectId, String groupId, @Nullable String cursor, int limit);
}
