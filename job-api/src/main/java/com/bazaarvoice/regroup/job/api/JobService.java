package com.bazaarvoice.regroup.job.api;

import javax.annotation.Nullable;

/**
 * Queues jobs for asynchronous execution and reports on them.
 */
public interface JobService {

    /**
     * Queues a job.  Its status is {@link JobStatus.Status#SUBMITTED} as soon as this returns.
     * @throws IllegalArgumentException if no handler is registered for the job's type
     */
    <Q, R> JobIdentifier<Q, R> submitJob(JobRequest<Q, R> jobRequest);

    /** Returns the job's status, or null if no job exists with the id. */
    @Nullable
    <Q, R> JobStatus<Q, R> getJobStatus(JobIdentifier<Q, R> id);
}
