package com.bazaarvoice.regroup.unmerge.db.memory;

import com.bazaarvoice.regroup.unmerge.api.Event;
import com.bazaarvoice.regroup.unmerge.api.EventPage;
import com.bazaarvoice.regroup.unmerge.api.EventSource;
import com.bazaarvoice.regroup.unmerge.api.EventStream;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Analytics index kept in memory.  Events are read in insertion order and the cursor is the insertion sequence of the
 * last event returned.
 * <p>
 * Group membership in the index only changes when an unmerge stream ends, so a source group reads the same while its
 * unmerge is running.
 */
public class InMemoryEventIndex implements EventSource, EventStream {

    private static final Logger _log = LoggerFactory.getLogger(InMemoryEventIndex.class);

    private static final String UNMERGE = "unmerge";
    private static final String UNMERGE_HIERARCHICAL = "unmerge_hierarchical";

    private final AtomicLong _nextSequence = new AtomicLong(1);
    private final NavigableMap<Long, Event> _events = Maps.newTreeMap();
    private final Set<String> _excludedGroups = Sets.newHashSet();
    private final Map<String, Map<String, Object>> _open = Maps.newHashMap();
    private final List<Map<String, Object>> _started = Lists.newArrayList();
    private final List<Map<String, Object>> _ended = Lists.newArrayList();

    public synchronized void insert(Event event) {
        requireNonNull(event, "event");
        _events.put(_nextSequence.getAndIncrement(), event);
    }

    public void insertAll(Collection<Event> events) {
        for (Event event : events) {
            insert(event);
        }
    }

    @Override
    public synchronized EventPage fetchPage(String projectId, String groupId, @Nullable String cursor, int limit) {
        requireNonNull(projectId, "projectId");
        requireNonNull(groupId, "groupId");
        checkArgument(limit > 0, "limit must be positive");

        if (_excludedGroups.contains(excludedKey(projectId, groupId))) {
            return new EventPage(ImmutableList.of(), null);
        }

        long after = parseCursor(cursor);
        List<Event> events = Lists.newArrayList();
        Long last = null;
        for (Map.Entry<Long, Event> entry : _events.tailMap(after, false).entrySet()) {
            Event event = entry.getValue();
            if (!event.getProjectId().equals(projectId) || !event.getGroupId().equals(groupId)) {
                continue;
            }
            if (events.size() == limit) {
                // More events follow the page
                return new EventPage(events, Long.toString(last));
            }
            events.add(event);
            last = entry.getKey();
        }
        return new EventPage(events, null);
    }

    @Override
    public synchronized Map<String, Object> startUnmerge(String projectId, Collection<String> hashes, String sourceId,
                                                         String destinationId) {
        return open(ImmutableMap.<String, Object>builder()
                .put("type", UNMERGE)
                .put("projectId", projectId)
                .put("hashes", ImmutableList.copyOf(hashes))
                .put("previousGroupId", sourceId)
                .put("newGroupId", destinationId)
                .build());
    }

    @Override
    public synchronized Map<String, Object> startUnmergeHierarchical(String projectId, String primaryHash,
                                                                     String hierarchicalHash, String sourceId,
                                                                     String destinationId, boolean skipNeedsFinal) {
        return open(ImmutableMap.<String, Object>builder()
                .put("type", UNMERGE_HIERARCHICAL)
                .put("projectId", projectId)
                .put("primaryHash", primaryHash)
                .put("hierarchicalHash", hierarchicalHash)
                .put("previousGroupId", sourceId)
                .put("newGroupId", destinationId)
                .put("skipNeedsFinal", skipNeedsFinal)
                .build());
    }

    @Override
    public synchronized void endUnmerge(Map<String, Object> state) {
        checkState(state, UNMERGE);
        Collection<?> hashes = (Collection<?>) state.get("hashes");
        int moved = regroup(state, event -> hashes.contains(event.getPrimaryHash()));
        close(state);
        _log.debug("Ended unmerge {}, regrouping {} event(s)", state.get("transactionId"), moved);
    }

    @Override
    public synchronized void endUnmergeHierarchical(Map<String, Object> state) {
        checkState(state, UNMERGE_HIERARCHICAL);
        Object primaryHash = state.get("primaryHash");
        Object hierarchicalHash = state.get("hierarchicalHash");
        int moved = regroup(state, event -> event.getPrimaryHash().equals(primaryHash)
                && event.getHierarchicalHashes().contains(hierarchicalHash));
        close(state);
        _log.debug("Ended hierarchical unmerge {}, regrouping {} event(s)", state.get("transactionId"), moved);
    }

    @Override
    public synchronized void excludeGroups(String projectId, Collection<String> groupIds) {
        for (String groupId : groupIds) {
            _excludedGroups.add(excludedKey(projectId, groupId));
        }
    }

    public synchronized boolean isExcluded(String projectId, String groupId) {
        return _excludedGroups.contains(excludedKey(projectId, groupId));
    }

    /** Returns the ids of the events the index lists under the group, in insertion order. */
    public synchronized List<String> getEventIds(String projectId, String groupId) {
        ImmutableList.Builder<String> eventIds = ImmutableList.builder();
        for (Event event : _events.values()) {
            if (event.getProjectId().equals(projectId) && event.getGroupId().equals(groupId)) {
                eventIds.add(event.getEventId());
            }
        }
        return eventIds.build();
    }

    public synchronized List<Map<String, Object>> getStartedStreams() {
        return ImmutableList.copyOf(_started);
    }

    public synchronized List<Map<String, Object>> getEndedStreams() {
        return ImmutableList.copyOf(_ended);
    }

    public synchronized Set<String> getExcludedGroups() {
        return ImmutableSet.copyOf(_excludedGroups);
    }

    /** Returns the open stream with the same description, or opens a new one. */
    private Map<String, Object> open(Map<String, Object> description) {
        String streamKey = streamKey(description);
        Map<String, Object> state = _open.get(streamKey);
        if (state != null) {
            _log.debug("Unmerge stream {} is already open", state.get("transactionId"));
            return state;
        }
        state = ImmutableMap.<String, Object>builder()
                .put("transactionId", UUID.randomUUID().toString())
                .putAll(description)
                .build();
        _open.put(streamKey, state);
        _started.add(state);
        return state;
    }

    private void close(Map<String, Object> state) {
        String streamKey = streamKey(state);
        Map<String, Object> open = _open.get(streamKey);
        if (open != null && open.get("transactionId").equals(state.get("transactionId"))) {
            _open.remove(streamKey);
        }
        _ended.add(ImmutableMap.copyOf(state));
    }

    private static String streamKey(Map<String, Object> state) {
        return Joiner.on('|').useForNull("").join(state.get("type"), state.get("projectId"),
                state.get("previousGroupId"), state.get("newGroupId"), state.get("hashes"), state.get("primaryHash"),
                state.get("hierarchicalHash"));
    }

    private int regroup(Map<String, Object> state, Predicate<Event> matches) {
        Object projectId = state.get("projectId");
        Object sourceId = state.get("previousGroupId");
        String destinationId = (String) state.get("newGroupId");

        int moved = 0;
        for (Map.Entry<Long, Event> entry : _events.entrySet()) {
            Event event = entry.getValue();
            if (event.getProjectId().equals(projectId) && event.getGroupId().equals(sourceId) && matches.test(event)) {
                entry.setValue(event.withGroupId(destinationId));
                moved += 1;
            }
        }
        return moved;
    }

    private static void checkState(Map<String, Object> state, String type) {
        requireNonNull(state, "state");
        checkArgument(type.equals(state.get("type")), "Not a %s stream state: %s", type, state);
    }

    private static long parseCursor(@Nullable String cursor) {
        if (cursor == null) {
            return 0;
        }
        try {
            return Long.parseLong(cursor);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
        }
    }

    private static String excludedKey(String projectId, String groupId) {
        return projectId + "/" + groupId;
    }
}
