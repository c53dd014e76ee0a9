package com.bazaarvoice.regroup.job.dao;

import com.bazaarvoice.regroup.job.api.JobIdentifier;
import com.bazaarvoice.regroup.job.api.JobStatus;
import com.google.common.collect.Maps;

import javax.annotation.Nullable;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Keeps statuses as the same JSON text ZooKeeper would hold, so a request that can't survive serialization fails in
 * tests too.
 */
public class InMemoryJobStatusDAO implements JobStatusDAO {

    private final Map<String, String> _statuses = Maps.newConcurrentMap();

    @Override
    public <Q, R> void updateJobStatus(JobIdentifier<Q, R> jobId, JobStatus<Q, R> jobStatus) {
        checkNotNull(jobStatus, "jobStatus");
        _statuses.put(jobId.toString(), JobStatusCodec.encode(jobStatus));
    }

    @Nullable
    @Override
    public <Q, R> JobStatus<Q, R> getJobStatus(JobIdentifier<Q, R> jobId) {
        String json = _statuses.get(jobId.toString());
        return json != null ? JobStatusCodec.decode(json, jobId.getJobType()) : null;
    }
}
