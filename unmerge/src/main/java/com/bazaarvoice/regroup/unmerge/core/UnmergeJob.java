package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.job.api.JobType;
import com.bazaarvoice.regroup.unmerge.api.UnmergeArgs;
import com.bazaarvoice.regroup.unmerge.api.UnmergePageResult;

/**
 * Job type for one page of an unmerge run.
 */
public class UnmergeJob extends JobType<UnmergeArgs, UnmergePageResult> {

    final public static UnmergeJob INSTANCE = new UnmergeJob();

    private UnmergeJob() {
        super("unmerge", UnmergeArgs.class, UnmergePageResult.class);
    }
}
