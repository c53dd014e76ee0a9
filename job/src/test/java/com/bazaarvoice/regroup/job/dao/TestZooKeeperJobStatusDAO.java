package com.bazaarvoice.regroup.job.dao;

import com.bazaarvoice.regroup.job.api.JobIdentifier;
import com.bazaarvoice.regroup.job.api.JobStatus;
import com.bazaarvoice.regroup.job.api.JobType;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.Closeables;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.RetryNTimes;
import org.apache.curator.test.TestingServer;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

public class TestZooKeeperJobStatusDAO {

    private TestingServer _testingServer;
    private CuratorFramework _curator;
    private ZooKeeperJobStatusDAO _dao;

    @BeforeMethod
    public void setUp() throws Exception {
        _testingServer = new TestingServer();
        _curator = CuratorFrameworkFactory.builder()
                .connectString(_testingServer.getConnectString())
                .retryPolicy(new RetryNTimes(3, 100))
                .build();
        _curator.start();
        _dao = new ZooKeeperJobStatusDAO(_curator, "/test/job-status");
    }

    @AfterMethod
    public void tearDown() throws Exception {
        Closeables.close(_curator, true);
        Closeables.close(_testingServer, true);
    }

    @Test
    public void testStatusLifecycle() {
        JobIdentifier<Map, String> jobId = JobIdentifier.createNew(new EchoJobType());
        assertNull(_dao.getJobStatus(jobId));

        Map<String, Object> request = ImmutableMap.<String, Object>of("groupId", "g1", "count", 3);
        _dao.updateJobStatus(jobId, new JobStatus<Map, String>(JobStatus.Status.SUBMITTED, request, null, null));

        JobStatus<Map, String> status = _dao.getJobStatus(jobId);
        assertEquals(status.getStatus(), JobStatus.Status.SUBMITTED);
        assertEquals(status.getRequest(), request);

        _dao.updateJobStatus(jobId, new JobStatus<Map, String>(JobStatus.Status.FINISHED, request, "done", null));
        status = _dao.getJobStatus(jobId);
        assertEquals(status.getStatus(), JobStatus.Status.FINISHED);
        assertEquals(status.getResult(), "done");
    }

    private static class EchoJobType extends JobType<Map, String> {
        EchoJobType() {
            super("echo", Map.class, String.class);
        }
    }
}
