package com.bazaarvoice.regroup.unmerge.api;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * Audit trail of completed unmerges.
 */
public interface ActivityLog {

    /** Records that events moved from the source into the destination.  Recording the same activity twice is harmless. */
    void record(String projectId, String sourceId, String destinationId, @Nullable String actorId,
                Map<String, Object> data);
}
