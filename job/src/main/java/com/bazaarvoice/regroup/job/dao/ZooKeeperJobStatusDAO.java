package com.bazaarvoice.regroup.job.dao;

import com.bazaarvoice.regroup.job.JobZooKeeper;
import com.bazaarvoice.regroup.job.api.JobIdentifier;
import com.bazaarvoice.regroup.job.api.JobStatus;
import com.google.common.base.Throwables;
import com.google.inject.Inject;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.utils.ZKPaths;
import org.apache.zookeeper.KeeperException;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stores each job's status as a JSON document in its own ZooKeeper node.  The request is part of the status, so the
 * node is also where a queued job's parameters live until the job runs.
 */
public class ZooKeeperJobStatusDAO implements JobStatusDAO {

    private final CuratorFramework _curator;
    private final String _rootPath;

    @Inject
    public ZooKeeperJobStatusDAO(@JobZooKeeper CuratorFramework curator, @JobStatusRootPath String rootPath) {
        _curator = checkNotNull(curator, "curator");
        _rootPath = checkNotNull(rootPath, "rootPath");
    }

    @Override
    public <Q, R> void updateJobStatus(JobIdentifier<Q, R> jobId, JobStatus<Q, R> jobStatus) {
        checkNotNull(jobId, "jobId");
        checkNotNull(jobStatus, "jobStatus");

        byte[] json = JobStatusCodec.encode(jobStatus).getBytes(StandardCharsets.UTF_8);
        try {
            _curator.create().orSetData().creatingParentsIfNeeded().forPath(getPath(jobId), json);
        } catch (Exception e) {
            throw propagate(e);
        }
    }

    @Nullable
    @Override
    public <Q, R> JobStatus<Q, R> getJobStatus(JobIdentifier<Q, R> jobId) {
        checkNotNull(jobId, "jobId");

        byte[] json;
        try {
            json = _curator.getData().forPath(getPath(jobId));
        } catch (KeeperException.NoNodeException e) {
            return null;
        } catch (Exception e) {
            throw propagate(e);
        }

        return JobStatusCodec.decode(new String(json, StandardCharsets.UTF_8), jobId.getJobType());
    }

    private String getPath(JobIdentifier<?, ?> jobId) {
        return ZKPaths.makePath(_rootPath, jobId.toString());
    }

    private RuntimeException propagate(Exception e) {
        Throwables.throwIfUnchecked(e);
        return new RuntimeException(e);
    }
}
