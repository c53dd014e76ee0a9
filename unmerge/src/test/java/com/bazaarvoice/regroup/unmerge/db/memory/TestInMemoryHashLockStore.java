package com.bazaarvoice.regroup.unmerge.db.memory;

import com.bazaarvoice.regroup.unmerge.api.HashLockEntry;
import com.bazaarvoice.regroup.unmerge.api.HashState;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public class TestInMemoryHashLockStore {

    private InMemoryHashLockStore _store;

    @BeforeMethod
    public void setUp() {
        _store = new InMemoryHashLockStore();
        _store.put("project", "a", "group-1", HashState.UNLOCKED);
        _store.put("project", "b", "group-1", HashState.UNLOCKED);
        _store.put("project", "c", "group-2", HashState.UNLOCKED);
    }

    @Test
    public void testLocksOnlyOwnedHashes() {
        assertEquals(_store.lockHashes("project", "group-1", ImmutableList.of("a", "c", "d")), ImmutableSet.of("a"));

        assertEquals(_store.get("project", "a").getState(), HashState.LOCKED_IN_MIGRATION);
        assertEquals(_store.get("project", "b").getState(), HashState.UNLOCKED);
        assertEquals(_store.get("project", "c").getState(), HashState.UNLOCKED);
        assertNull(_store.get("project", "d"));
    }

    @Test
    public void testLockingAgainReturnsSameHashes() {
        _store.lockHashes("project", "group-1", ImmutableList.of("a", "b"));

        assertEquals(_store.lockHashes("project", "group-1", ImmutableList.of("a", "b")), ImmutableSet.of("a", "b"));
    }

    @Test
    public void testProjectsAreSeparate() {
        assertTrue(_store.lockHashes("other", "group-1", ImmutableList.of("a")).isEmpty());
    }

    @Test
    public void testUnlockOnlyFromExpectedState() {
        _store.put("project", "s", "group-1", HashState.SPLIT);
        _store.lockHashes("project", "group-1", ImmutableList.of("a"));

        assertEquals(_store.unlock("project", ImmutableList.of("a", "b", "s"), HashState.LOCKED_IN_MIGRATION),
                ImmutableSet.of("a"));
        assertEquals(_store.get("project", "s").getState(), HashState.SPLIT);

        assertEquals(_store.unlock("project", ImmutableList.of("a", "s"), HashState.SPLIT), ImmutableSet.of("s"));
        assertEquals(_store.get("project", "s"), new HashLockEntry("project", "s", "group-1", HashState.UNLOCKED));
    }

    @Test
    public void testReassignKeepsLockState() {
        _store.lockHashes("project", "group-1", ImmutableList.of("a"));

        _store.reassign("project", ImmutableList.of("a", "missing"), "group-3");

        assertEquals(_store.get("project", "a"), new HashLockEntry("project", "a", "group-3", HashState.LOCKED_IN_MIGRATION));
        assertNull(_store.get("project", "missing"));
    }

    @Test
    public void testUpsert() {
        _store.upsert("project", "new", "group-3");
        _store.upsert("project", "c", "group-3");

        assertEquals(_store.get("project", "new"), new HashLockEntry("project", "new", "group-3", HashState.UNLOCKED));
        assertEquals(_store.get("project", "c").getGroupId(), "group-3");
    }
}
