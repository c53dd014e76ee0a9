package com.bazaarvoice.regroup.job.service;

/**
 * Runs queued jobs on the calling thread so tests don't wait on the job service's scheduler.
 */
public class JobServiceDriver {

    private final DefaultJobService _jobService;

    public JobServiceDriver(DefaultJobService jobService) {
        _jobService = jobService;
    }

    public boolean runNextJob() {
        return _jobService.runNextJob();
    }

    /** Runs jobs until the queue is empty, returning the number of jobs run. */
    public int runAllJobs() {
        int count = 0;
        while (_jobService.runNextJob()) {
            count += 1;
        }
        return count;
    }
}
