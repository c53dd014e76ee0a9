package com.bazaarvoice.regroup.job.dao;

import com.bazaarvoice.regroup.job.api.JobIdentifier;
import com.bazaarvoice.regroup.job.api.JobStatus;

import javax.annotation.Nullable;

/**
 * Durable record of each job's request and progress.  Statuses are never deleted; a finished page's result is how the
 * next page of a run is found.
 */
public interface JobStatusDAO {

    <Q, R> void updateJobStatus(JobIdentifier<Q, R> jobId, JobStatus<Q, R> jobStatus);

    @Nullable
    <Q, R> JobStatus<Q, R> getJobStatus(JobIdentifier<Q, R> jobId);
}
