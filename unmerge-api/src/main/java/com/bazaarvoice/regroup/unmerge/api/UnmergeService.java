package com.bazaarvoice.regroup.unmerge.api;

/**
 * Entry point for splitting events out of a group.  An unmerge runs asynchronously as a chain of pages; each page is
 * a job which processes one batch of the source group's events and queues the next.
 */
public interface UnmergeService {

    /**
     * Starts an unmerge.
     * @return A reference to the run's first page, for use with {@link #getStatus(String)}.
     */
    String unmerge(UnmergeRequest request);

    /**
     * Returns the progress of the run a reference belongs to.
     * @throws UnknownUnmergeException if the reference does not name an unmerge page
     */
    UnmergeStatus getStatus(String reference);
}
