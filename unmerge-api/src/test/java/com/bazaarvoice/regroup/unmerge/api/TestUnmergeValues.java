package com.bazaarvoice.regroup.unmerge.api;

import com.bazaarvoice.regroup.common.json.JsonHelper;
import com.google.common.collect.ImmutableList;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public class TestUnmergeValues {

    @Test
    public void testFinishedPageResultRoundTrip() {
        UnmergePageResult result = new UnmergePageResult(3, 1, null);

        Map<?, ?> json = JsonHelper.convert(result, Map.class);
        assertFalse(json.containsKey("finished"));

        UnmergePageResult parsed = JsonHelper.fromJson(JsonHelper.asJson(result), UnmergePageResult.class);
        assertEquals(parsed.getEventsMoved(), 3);
        assertEquals(parsed.getEventsKept(), 1);
        assertNull(parsed.getNextReference());
        assertTrue(parsed.isFinished());
    }

    @Test
    public void testPageResultToleratesExtraFields() {
        UnmergePageResult parsed = JsonHelper.fromJson(
                "{\"eventsMoved\":2,\"eventsKept\":0,\"nextReference\":\"job-2\",\"finished\":false}",
                UnmergePageResult.class);

        assertEquals(parsed.getNextReference(), "job-2");
        assertFalse(parsed.isFinished());
    }

    @Test
    public void testHierarchyEndsAtFirstMissingLevel() {
        Event event = new Event("e1", "project", "group-1", "p1", Arrays.asList("h0", null, "h2"), Instant.EPOCH);

        assertEquals(event.getHierarchicalHashes(), ImmutableList.of("h0"));
    }

    @Test
    public void testHierarchyWithMissingFirstLevelIsEmpty() {
        Event event = new Event("e1", "project", "group-1", "p1", Arrays.asList(null, "h1"), Instant.EPOCH);

        assertTrue(event.getHierarchicalHashes().isEmpty());
    }

    @Test
    public void testHierarchicalReplacementHashesEveryField() {
        HierarchicalUnmergeReplacement base = new HierarchicalUnmergeReplacement(
                "p1", "h1", 1, 3, true, ImmutableList.of("h1"));
        HierarchicalUnmergeReplacement notEmptied = new HierarchicalUnmergeReplacement(
                "p1", "h1", 1, 3, false, ImmutableList.of("h1"));
        HierarchicalUnmergeReplacement otherReset = new HierarchicalUnmergeReplacement(
                "p1", "h1", 1, 3, true, ImmutableList.of("h1", "h0"));

        assertEquals(base, new HierarchicalUnmergeReplacement("p1", "h1", 1, 3, true, ImmutableList.of("h1")));
        assertEquals(base.hashCode(),
                new HierarchicalUnmergeReplacement("p1", "h1", 1, 3, true, ImmutableList.of("h1")).hashCode());
        assertNotEquals(base.hashCode(), notEmptied.hashCode());
        assertNotEquals(base.hashCode(), otherReset.hashCode());
    }
}
