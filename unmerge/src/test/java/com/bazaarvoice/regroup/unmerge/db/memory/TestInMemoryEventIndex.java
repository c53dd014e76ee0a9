package com.bazaarvoice.regroup.unmerge.db.memory;

import com.bazaarvoice.regroup.common.json.JsonHelper;
import com.bazaarvoice.regroup.unmerge.api.Event;
import com.bazaarvoice.regroup.unmerge.api.EventPage;
import com.google.common.collect.ImmutableList;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertTrue;

public class TestInMemoryEventIndex {

    private InMemoryEventIndex _index;

    @BeforeMethod
    public void setUp() {
        _index = new InMemoryEventIndex();
        for (int i = 0; i < 5; i++) {
            _index.insert(event("e" + i, i % 2 == 0 ? "group-1" : "group-2", "a", ImmutableList.of("h" + i)));
        }
    }

    @Test
    public void testPagesInInsertionOrder() {
        EventPage first = _index.fetchPage("project", "group-1", null, 2);
        assertEquals(eventIds(first.getEvents()), ImmutableList.of("e0", "e2"));
        assertNotNull(first.getNextCursor());

        EventPage second = _index.fetchPage("project", "group-1", first.getNextCursor(), 2);
        assertEquals(eventIds(second.getEvents()), ImmutableList.of("e4"));
        assertTrue(second.isExhausted());
    }

    @Test
    public void testFullLastPageIsExhausted() {
        EventPage page = _index.fetchPage("project", "group-2", null, 2);

        assertEquals(eventIds(page.getEvents()), ImmutableList.of("e1", "e3"));
        assertTrue(page.isExhausted());
    }

    @Test
    public void testUnknownGroupIsEmpty() {
        EventPage page = _index.fetchPage("project", "group-9", null, 10);

        assertTrue(page.getEvents().isEmpty());
        assertTrue(page.isExhausted());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInvalidCursor() {
        _index.fetchPage("project", "group-1", "abc", 10);
    }

    @Test
    public void testMembershipChangesWhenStreamEnds() {
        Map<String, Object> state = _index.startUnmerge("project", ImmutableList.of("a"), "group-1", "group-3");
        assertEquals(_index.getEventIds("project", "group-1"), ImmutableList.of("e0", "e2", "e4"));

        // Stream state comes back from serialized job arguments
        @SuppressWarnings("unchecked")
        Map<String, Object> stored = JsonHelper.convert(state, Map.class);
        _index.endUnmerge(stored);
        _index.endUnmerge(stored);

        assertTrue(_index.getEventIds("project", "group-1").isEmpty());
        assertEquals(_index.getEventIds("project", "group-3"), ImmutableList.of("e0", "e2", "e4"));
        assertEquals(_index.getEventIds("project", "group-2"), ImmutableList.of("e1", "e3"));
    }

    @Test
    public void testHierarchicalMembership() {
        Map<String, Object> state = _index.startUnmergeHierarchical("project", "a", "h2", "group-1", "group-3", false);

        _index.endUnmergeHierarchical(state);

        assertEquals(_index.getEventIds("project", "group-3"), ImmutableList.of("e2"));
        assertEquals(state.get("skipNeedsFinal"), false);
    }

    @Test
    public void testStartingAnOpenStreamAgainReturnsIt() {
        Map<String, Object> first = _index.startUnmerge("project", ImmutableList.of("a"), "group-1", "group-3");
        Map<String, Object> second = _index.startUnmerge("project", ImmutableList.of("a"), "group-1", "group-3");
        Map<String, Object> hierarchical = _index.startUnmergeHierarchical("project", "a", "h2", "group-1", "group-4", true);

        assertEquals(second, first);
        assertEquals(_index.startUnmergeHierarchical("project", "a", "h2", "group-1", "group-4", true), hierarchical);
        assertEquals(_index.getStartedStreams().size(), 2);
    }

    @Test
    public void testEndedStreamCanBeStartedAgain() {
        Map<String, Object> first = _index.startUnmerge("project", ImmutableList.of("a"), "group-1", "group-3");
        @SuppressWarnings("unchecked")
        Map<String, Object> stored = JsonHelper.convert(first, Map.class);
        _index.endUnmerge(stored);

        Map<String, Object> second = _index.startUnmerge("project", ImmutableList.of("a"), "group-1", "group-3");

        assertNotEquals(second.get("transactionId"), first.get("transactionId"));
        assertEquals(_index.getStartedStreams().size(), 2);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testEndingWrongKindOfStream() {
        _index.endUnmergeHierarchical(_index.startUnmerge("project", ImmutableList.of("a"), "group-1", "group-3"));
    }

    @Test
    public void testExcludedGroupIsNotRead() {
        _index.excludeGroups("project", ImmutableList.of("group-1"));
        _index.excludeGroups("project", ImmutableList.of("group-1"));

        assertTrue(_index.fetchPage("project", "group-1", null, 10).getEvents().isEmpty());
        assertEquals(_index.fetchPage("project", "group-2", null, 10).getEvents().size(), 2);
        assertEquals(_index.getExcludedGroups().size(), 1);
    }

    private static List<String> eventIds(List<Event> events) {
        ImmutableList.Builder<String> eventIds = ImmutableList.builder();
        for (Event event : events) {
            eventIds.add(event.getEventId());
        }
        return eventIds.build();
    }

    private static Event event(String eventId, String groupId, String primaryHash, List<String> hierarchicalHashes) {
        return new Event(eventId, "project", groupId, primaryHash, hierarchicalHashes, Instant.ofEpochSecond(0));
    }
}
