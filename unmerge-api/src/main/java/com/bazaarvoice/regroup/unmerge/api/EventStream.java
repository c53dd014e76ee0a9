package com.bazaarvoice.regroup.unmerge.api;

import java.util.Collection;
import java.util.Map;

/**
 * Coordinates an unmerge with the analytics index.  Starting an unmerge returns opaque state which is carried by the
 * run until the matching end call.  Starting the same unmerge again while it is open returns the open state, so a
 * repeated page doesn't leave a snapshot behind.  Ending the same state twice is harmless.
 */
public interface EventStream {

    Map<String, Object> startUnmerge(String projectId, Collection<String> hashes, String sourceId,
                                     String destinationId);

    Map<String, Object> startUnmergeHierarchical(String projectId, String primaryHash, String hierarchicalHash,
                                                 String sourceId, String destinationId, boolean skipNeedsFinal);

    void endUnmerge(Map<String, Object> state);

    void endUnmergeHierarchical(Map<String, Object> state);

    /** Excludes the groups from the index.  Excluding a group twice is harmless. */
    void excludeGroups(String projectId, Collection<String> groupIds);
}
