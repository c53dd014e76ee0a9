package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.unmerge.api.Event;
import com.bazaarvoice.regroup.unmerge.api.EventStream;
import com.bazaarvoice.regroup.unmerge.api.HashLockStore;
import com.bazaarvoice.regroup.unmerge.api.HashState;
import com.bazaarvoice.regroup.unmerge.api.HierarchicalUnmergeReplacement;
import com.bazaarvoice.regroup.unmerge.api.PrimaryHashUnmergeReplacement;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.mockito.InOrder;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestReplacementPolicies {

    private HashLockStore _hashLockStore;
    private EventStream _eventStream;
    private ReplacementPolicyFactory _factory;

    @BeforeMethod
    public void setUp() {
        _hashLockStore = mock(HashLockStore.class);
        _eventStream = mock(EventStream.class);
        _factory = new ReplacementPolicyFactory(_hashLockStore, _eventStream);
    }

    @Test
    public void testPrimaryHashMovesOnlyLockedFingerprints() {
        ReplacementPolicy policy = _factory.forReplacement(new PrimaryHashUnmergeReplacement(ImmutableList.of("a", "b")));

        ImmutableSet<String> locked = ImmutableSet.of("a");
        assertEquals(policy.getUnmergeKey(event("e1", "a"), locked), Optional.of("default"));
        // Fingerprint owned by another group
        assertEquals(policy.getUnmergeKey(event("e2", "b"), locked), Optional.empty());
        assertEquals(policy.getUnmergeKey(event("e3", "c"), ImmutableSet.of("a", "c")), Optional.empty());
        assertEquals(policy.getPrimaryHashesToLock(), ImmutableSet.of("a", "b"));
    }

    @Test
    public void testPrimaryHashReassignsLockedHashes() {
        ReplacementPolicy policy = _factory.forReplacement(new PrimaryHashUnmergeReplacement(ImmutableList.of("a", "b")));

        policy.reassignHashes("project", "default", "group-2", ImmutableSet.of("a"));

        verify(_hashLockStore).reassign("project", ImmutableSet.of("a"), "group-2");
    }

    @Test
    public void testPrimaryHashActivityData() {
        ReplacementPolicy policy = _factory.forReplacement(new PrimaryHashUnmergeReplacement(ImmutableList.of("a")));

        assertEquals(policy.getActivityData("default"), ImmutableMap.of("fingerprints", ImmutableList.of("a")));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testPrimaryHashActivityDataForUnknownKey() {
        ReplacementPolicy policy = _factory.forReplacement(new PrimaryHashUnmergeReplacement(ImmutableList.of("a")));

        policy.getActivityData("h3");
    }

    @Test
    public void testPrimaryHashStream() {
        ReplacementPolicy policy = _factory.forReplacement(new PrimaryHashUnmergeReplacement(ImmutableList.of("a")));

        policy.startStream("project", "group-1", "default", "group-2");
        policy.stopStream(null);
        policy.stopStream(ImmutableMap.<String, Object>of("transactionId", "t-1"));
        policy.onFinish("project", "group-1");

        verify(_eventStream).startUnmerge("project", ImmutableSet.of("a"), "group-1", "group-2");
        verify(_eventStream).endUnmerge(ImmutableMap.<String, Object>of("transactionId", "t-1"));
        verify(_eventStream, never()).excludeGroups(any(), any());
    }

    @Test
    public void testHierarchicalKeys() {
        ReplacementPolicy policy = _factory.forReplacement(hierarchical(1, 2, false));
        ImmutableSet<String> none = ImmutableSet.of();

        assertEquals(policy.getUnmergeKey(event("e1", "p1", "h0", "hA", "x1"), none), Optional.of("x1"));
        assertEquals(policy.getUnmergeKey(event("e2", "p1", "h0", "hA", "x2", "y2"), none), Optional.of("x2"));
        // Filtered out by the hash at the filter level
        assertEquals(policy.getUnmergeKey(event("e3", "p1", "h0", "hB", "x1"), none), Optional.empty());
        // Other primary hash
        assertEquals(policy.getUnmergeKey(event("e4", "p2", "h0", "hA", "x1"), none), Optional.empty());
        // Too short to reach the filter level
        assertEquals(policy.getUnmergeKey(event("e5", "p1", "h0"), none), Optional.empty());
        assertEquals(policy.getUnmergeKey(event("e6", "p1"), none), Optional.empty());
        assertTrue(policy.getPrimaryHashesToLock().isEmpty());
    }

    @Test
    public void testHierarchicalKeyFallsBackToMostSpecificLevel() {
        ReplacementPolicy policy = _factory.forReplacement(hierarchical(0, 5, false));

        assertEquals(policy.getUnmergeKey(event("e1", "p1", "h0", "h1", "h2"), ImmutableSet.of()), Optional.of("h2"));
        assertEquals(policy.getUnmergeKey(event("e2", "p1", "h0"), ImmutableSet.of()), Optional.of("h0"));
    }

    @Test
    public void testHierarchicalKeyIsDeterministic() {
        ReplacementPolicy policy = _factory.forReplacement(hierarchical(1, 2, false));
        Event event = event("e1", "p1", "h0", "hA", "x1");

        for (int i = 0; i < 10; i++) {
            assertEquals(policy.getUnmergeKey(event, ImmutableSet.of("p1")), Optional.of("x1"));
        }
    }

    @Test
    public void testHierarchicalResetsSplitHashesBeforeAssigning() {
        ReplacementPolicy policy = _factory.forReplacement(hierarchical(1, 2, false));

        policy.reassignHashes("project", "x1", "group-2", ImmutableSet.of());

        InOrder order = inOrder(_hashLockStore);
        order.verify(_hashLockStore).unlock("project", ImmutableList.of("x1", "hA"), HashState.SPLIT);
        order.verify(_hashLockStore).upsert("project", "x1", "group-2");
    }

    @Test
    public void testHierarchicalWithoutResetHashes() {
        ReplacementPolicy policy = _factory.forReplacement(
                new HierarchicalUnmergeReplacement("p1", "hA", 1, 2, false, ImmutableList.of()));

        policy.reassignHashes("project", "x1", "group-2", ImmutableSet.of());

        verify(_hashLockStore, never()).unlock(any(), any(), any());
        verify(_hashLockStore).upsert("project", "x1", "group-2");
    }

    @Test
    public void testHierarchicalStreamAndFinish() {
        ReplacementPolicy policy = _factory.forReplacement(hierarchical(1, 2, true));

        policy.startStream("project", "group-1", "x1", "group-2");
        policy.stopStream(ImmutableMap.<String, Object>of("transactionId", "t-1"));
        policy.onFinish("project", "group-1");

        verify(_eventStream).startUnmergeHierarchical("project", "p1", "x1", "group-1", "group-2", true);
        verify(_eventStream).endUnmergeHierarchical(ImmutableMap.<String, Object>of("transactionId", "t-1"));
        verify(_eventStream).excludeGroups("project", ImmutableList.of("group-1"));
        assertEquals(policy.getActivityData("x1"), ImmutableMap.of("newHierarchicalHash", "x1"));
    }

    @Test
    public void testHierarchicalKeepsSourceInIndexUnlessEmptied() {
        ReplacementPolicy policy = _factory.forReplacement(hierarchical(1, 2, false));

        policy.onFinish("project", "group-1");

        verifyNoInteractions(_eventStream);
    }

    @Test
    public void testPartitionKeepsPageOrder() {
        ReplacementPolicy policy = _factory.forReplacement(hierarchical(1, 2, false));
        List<Event> events = ImmutableList.of(
                event("e1", "p1", "h0", "hA", "x2"),
                event("e2", "p2"),
                event("e3", "p1", "h0", "hA", "x1"),
                event("e4", "p1", "h0", "hA", "x2"),
                event("e5", "p1", "h0", "hB"));

        EventPartition partition = EventPartition.of(events, policy, ImmutableSet.of());

        assertTrue(partition.hasMoves());
        assertEquals(ImmutableList.copyOf(partition.getMoves().keySet()), ImmutableList.of("x2", "x1"));
        assertEquals(partition.getMoves().get("x2"), ImmutableList.of(events.get(0), events.get(3)));
        assertEquals(partition.getStays(), ImmutableList.of(events.get(1), events.get(4)));
    }

    @Test
    public void testPartitionWithoutMoves() {
        ReplacementPolicy policy = _factory.forReplacement(new PrimaryHashUnmergeReplacement(ImmutableList.of("a")));

        EventPartition partition = EventPartition.of(ImmutableList.of(event("e1", "a")), policy, ImmutableSet.of());

        assertFalse(partition.hasMoves());
        assertEquals(partition.getStays().size(), 1);
    }

    private static HierarchicalUnmergeReplacement hierarchical(int filterLevel, int newLevel, boolean assumeSourceEmptied) {
        String filterHash = filterLevel == 0 ? "h0" : "hA";
        return new HierarchicalUnmergeReplacement("p1", filterHash, filterLevel, newLevel, assumeSourceEmptied,
                ImmutableList.of("x1", "hA"));
    }

    private static Event event(String eventId, String primaryHash, String... hierarchicalHashes) {
        return new Event(eventId, "project", "group-1", primaryHash, ImmutableList.copyOf(hierarchicalHashes),
                Instant.ofEpochSecond(1000));
    }
}
