package com.bazaarvoice.regroup.unmerge.db.memory;

import com.bazaarvoice.regroup.unmerge.api.HashLockEntry;
import com.bazaarvoice.regroup.unmerge.api.HashLockStore;
import com.bazaarvoice.regroup.unmerge.api.HashState;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * Hash lock table kept in memory.  Every operation is atomic with respect to the other operations on the same project.
 */
public class InMemoryHashLockStore implements HashLockStore {

    private static final Logger _log = LoggerFactory.getLogger(InMemoryHashLockStore.class);

    private final ConcurrentMap<String, Map<String, HashLockEntry>> _entriesByProject = Maps.newConcurrentMap();

    /** Assigns the hash to the group in the given state, replacing any existing entry. */
    public void put(String projectId, String hash, String groupId, HashState state) {
        Map<String, HashLockEntry> entries = getEntries(projectId);
        synchronized (entries) {
            entries.put(hash, new HashLockEntry(projectId, hash, groupId, state));
        }
    }

    @Override
    public Set<String> lockHashes(String projectId, String sourceId, Collection<String> hashes) {
        requireNonNull(sourceId, "sourceId");
        requireNonNull(hashes, "hashes");

        Map<String, HashLockEntry> entries = getEntries(projectId);
        ImmutableSet.Builder<String> locked = ImmutableSet.builder();
        synchronized (entries) {
            for (String hash : hashes) {
                HashLockEntry entry = entries.get(hash);
                if (entry == null || !entry.getGroupId().equals(sourceId)) {
                    continue;
                }
                if (entry.getState() != HashState.LOCKED_IN_MIGRATION) {
                    entries.put(hash, entry.withState(HashState.LOCKED_IN_MIGRATION));
                }
                locked.add(hash);
            }
        }
        Set<String> result = locked.build();
        _log.debug("Locked {} of {} hash(es) of group {}", result.size(), hashes.size(), sourceId);
        return result;
    }

    @Override
    public void reassign(String projectId, Collection<String> hashes, String groupId) {
        requireNonNull(hashes, "hashes");
        requireNonNull(groupId, "groupId");

        Map<String, HashLockEntry> entries = getEntries(projectId);
        synchronized (entries) {
            for (String hash : hashes) {
                HashLockEntry entry = entries.get(hash);
                if (entry != null) {
                    entries.put(hash, entry.withGroupId(groupId));
                }
            }
        }
    }

    @Override
    public void upsert(String projectId, String hash, String groupId) {
        requireNonNull(hash, "hash");
        requireNonNull(groupId, "groupId");

        Map<String, HashLockEntry> entries = getEntries(projectId);
        synchronized (entries) {
            HashLockEntry entry = entries.get(hash);
            entries.put(hash, entry != null
                    ? entry.withGroupId(groupId)
                    : new HashLockEntry(projectId, hash, groupId, HashState.UNLOCKED));
        }
    }

    @Override
    public Set<String> unlock(String projectId, Collection<String> hashes, HashState expectedState) {
        requireNonNull(hashes, "hashes");
        requireNonNull(expectedState, "expectedState");

        Map<String, HashLockEntry> entries = getEntries(projectId);
        ImmutableSet.Builder<String> unlocked = ImmutableSet.builder();
        synchronized (entries) {
            for (String hash : hashes) {
                HashLockEntry entry = entries.get(hash);
                if (entry != null && entry.getState() == expectedState && expectedState != HashState.UNLOCKED) {
                    entries.put(hash, entry.withState(HashState.UNLOCKED));
                    unlocked.add(hash);
                }
            }
        }
        return unlocked.build();
    }

    @Nullable
    @Override
    public HashLockEntry get(String projectId, String hash) {
        Map<String, HashLockEntry> entries = getEntries(projectId);
        synchronized (entries) {
            return entries.get(hash);
        }
    }

    private Map<String, HashLockEntry> getEntries(String projectId) {
        requireNonNull(projectId, "projectId");
        return _entriesByProject.computeIfAbsent(projectId, ignored -> Maps.newHashMap());
    }
}
