package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.unmerge.api.Event;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Behavior of an {@link com.bazaarvoice.regroup.unmerge.api.UnmergeReplacement} while an unmerge runs.  The key
 * decision is pure; the remaining operations write to the stores on behalf of one unmerge key and are safe to repeat.
 */
public interface ReplacementPolicy {

    /**
     * Returns the key of the destination the event moves to, or empty if the event stays in the source group.
     * The result depends only on the event and the locked hashes.  Events missing the data the replacement filters
     * on stay in the source.
     */
    Optional<String> getUnmergeKey(Event event, Set<String> lockedPrimaryHashes);

    /** Hashes to lock before the first page is read. */
    Set<String> getPrimaryHashesToLock();

    /** Starts coordinating the move of one key's events with the analytics index. */
    Map<String, Object> startStream(String projectId, String sourceId, String unmergeKey, String destinationId);

    /** Ends coordination started by {@link #startStream}.  Does nothing for null state. */
    void stopStream(@Nullable Map<String, Object> streamState);

    /** Routes the hashes of one key's events to its destination group. */
    void reassignHashes(String projectId, String unmergeKey, String destinationId, Set<String> lockedPrimaryHashes);

    /** Describes what moved into one key's destination, for the activity log. */
    Map<String, Object> getActivityData(String unmergeKey);

    /** Called once the last page of the run has been processed. */
    void onFinish(String projectId, String sourceId);
}
