package com.bazaarvoice.regroup.unmerge.db.memory;

import com.bazaarvoice.regroup.unmerge.api.Event;
import com.bazaarvoice.regroup.unmerge.api.Group;
import com.bazaarvoice.regroup.unmerge.api.GroupStore;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Relational group store kept in memory: groups with their summary fields, and the event rows pointing at them.
 */
public class InMemoryGroupStore implements GroupStore {

    private static final Logger _log = LoggerFactory.getLogger(InMemoryGroupStore.class);

    private final Map<String, GroupRecord> _groups = Maps.newHashMap();
    private final Map<String, String> _groupIdByEventKey = Maps.newLinkedHashMap();
    private final Map<String, String> _groupIdByRunKey = Maps.newHashMap();

    /** Adds the group with summary fields computed from the events, and rows for each of the events. */
    public synchronized void addGroup(String projectId, String groupId, List<Event> events) {
        checkArgument(!_groups.containsKey(key(projectId, groupId)), "Group already exists: %s", groupId);
        GroupRecord group = new GroupRecord();
        group.fold(events);
        _groups.put(key(projectId, groupId), group);
        for (Event event : events) {
            _groupIdByEventKey.put(key(projectId, event.getEventId()), groupId);
        }
    }

    @Override
    public synchronized String createGroup(String projectId, String runId, String unmergeKey, List<Event> events) {
        requireNonNull(runId, "runId");
        requireNonNull(unmergeKey, "unmergeKey");

        String runKey = key(projectId, runId + "/" + unmergeKey);
        String groupId = _groupIdByRunKey.get(runKey);
        if (groupId != null) {
            _log.debug("Group {} already exists for key {} of unmerge {}", groupId, unmergeKey, runId);
            return groupId;
        }

        groupId = UUID.randomUUID().toString();
        GroupRecord group = new GroupRecord();
        group.fold(events);
        _groups.put(key(projectId, groupId), group);
        _groupIdByRunKey.put(runKey, groupId);
        return groupId;
    }

    @Override
    public synchronized void resetSourceFields(String projectId, String groupId, List<Event> events) {
        GroupRecord group = getRecord(projectId, groupId);
        group.clear();
        group.fold(events);
    }

    @Override
    public synchronized void backfillGroup(String projectId, String groupId, List<Event> events) {
        getRecord(projectId, groupId).fold(events);
    }

    @Override
    public synchronized void moveEvents(String projectId, Map<String, String> destinationIdByEventId) {
        for (Map.Entry<String, String> entry : destinationIdByEventId.entrySet()) {
            String eventKey = key(projectId, entry.getKey());
            checkArgument(_groupIdByEventKey.containsKey(eventKey), "Unknown event: %s", entry.getKey());
            _groupIdByEventKey.put(eventKey, entry.getValue());
        }
    }

    @Nullable
    @Override
    public synchronized Group getGroup(String projectId, String groupId) {
        GroupRecord group = _groups.get(key(projectId, groupId));
        if (group == null) {
            return null;
        }
        return new Group(projectId, groupId, group._firstSeen, group._lastSeen, group._eventIds.size());
    }

    @Nullable
    public synchronized String getGroupIdForEvent(String projectId, String eventId) {
        return _groupIdByEventKey.get(key(projectId, eventId));
    }

    /** Returns the ids of the event rows pointing at the group, in the order they were added. */
    public synchronized List<String> getEventIds(String projectId, String groupId) {
        ImmutableList.Builder<String> eventIds = ImmutableList.builder();
        String prefix = projectId + "/";
        for (Map.Entry<String, String> entry : _groupIdByEventKey.entrySet()) {
            if (entry.getKey().startsWith(prefix) && entry.getValue().equals(groupId)) {
                eventIds.add(entry.getKey().substring(prefix.length()));
            }
        }
        return eventIds.build();
    }

    public synchronized int getGroupCount(String projectId) {
        int count = 0;
        for (String key : _groups.keySet()) {
            if (key.startsWith(projectId + "/")) {
                count += 1;
            }
        }
        return count;
    }

    private GroupRecord getRecord(String projectId, String groupId) {
        GroupRecord group = _groups.get(key(projectId, groupId));
        checkArgument(group != null, "Unknown group: %s", groupId);
        return group;
    }

    private static String key(String projectId, String id) {
        return requireNonNull(projectId, "projectId") + "/" + requireNonNull(id, "id");
    }

    private static class GroupRecord {
        private Instant _firstSeen;
        private Instant _lastSeen;
        private final Set<String> _eventIds = Sets.newHashSet();

        void clear() {
            _firstSeen = null;
            _lastSeen = null;
            _eventIds.clear();
        }

        void fold(List<Event> events) {
            for (Event event : events) {
                if (!_eventIds.add(event.getEventId())) {
                    continue;
                }
                Instant timestamp = event.getTimestamp();
                if (_firstSeen == null || timestamp.isBefore(_firstSeen)) {
                    _firstSeen = timestamp;
                }
                if (_lastSeen == null || timestamp.isAfter(_lastSeen)) {
                    _lastSeen = timestamp;
                }
            }
        }
    }
}
