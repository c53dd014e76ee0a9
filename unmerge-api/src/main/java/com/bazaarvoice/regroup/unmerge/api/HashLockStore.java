package com.bazaarvoice.regroup.unmerge.api;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.Set;

/**
 * The hash lock table: which group owns each hash of a project.  Every update is a conditional update of a single
 * {@code (project, hash)} entry, so runs over disjoint hashes never interfere.
 */
public interface HashLockStore {

    /**
     * Locks those of the hashes which are owned by the source group for migration.  Locking again is harmless.
     * @return Every one of the hashes which the source group owns and which is now locked for migration.
     */
    Set<String> lockHashes(String projectId, String sourceId, Collection<String> hashes);

    /** Transfers ownership of existing entries to the group, leaving their lock state unchanged. */
    void reassign(String projectId, Collection<String> hashes, String groupId);

    /** Assigns the hash to the group, creating an unlocked entry if the hash has none. */
    void upsert(String projectId, String hash, String groupId);

    /**
     * Unlocks those of the hashes which are currently in the expected state.
     * @return The hashes which were unlocked by this call.
     */
    Set<String> unlock(String projectId, Collection<String> hashes, HashState expectedState);

    @Nullable
    HashLockEntry get(String projectId, String hash);
}
