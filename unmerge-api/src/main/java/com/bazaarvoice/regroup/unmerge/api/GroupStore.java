package com.bazaarvoice.regroup.unmerge.api;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * The primary event store: groups, their summary fields, and which group each event row belongs to.
 */
public interface GroupStore {

    /**
     * Creates the destination group for one unmerge key of a run, with summary fields computed from the events.
     * Creating the group for the same run and key again returns the existing group.
     * @return The id of the destination group.
     */
    String createGroup(String projectId, String runId, String unmergeKey, List<Event> events);

    /** Replaces the group's summary fields with those computed from the events. */
    void resetSourceFields(String projectId, String groupId, List<Event> events);

    /** Folds the events into the group's summary fields.  Folding in an event twice counts it once. */
    void backfillGroup(String projectId, String groupId, List<Event> events);

    /** Moves event rows and the records attached to them to new groups, keyed by event id. */
    void moveEvents(String projectId, Map<String, String> destinationIdByEventId);

    @Nullable
    Group getGroup(String projectId, String groupId);
}
