package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.job.api.JobIdentifier;
import com.bazaarvoice.regroup.job.api.JobRequest;
import com.bazaarvoice.regroup.job.api.JobService;
import com.bazaarvoice.regroup.unmerge.api.InitialUnmergeArgs;
import com.bazaarvoice.regroup.unmerge.api.PrimaryHashUnmergeReplacement;
import com.bazaarvoice.regroup.unmerge.api.TransientStoreException;
import com.bazaarvoice.regroup.unmerge.api.UnmergeArgs;
import com.bazaarvoice.regroup.unmerge.api.UnmergeFailedException;
import com.bazaarvoice.regroup.unmerge.api.UnmergePageResult;
import com.codahale.metrics.MetricRegistry;
import com.google.common.collect.ImmutableList;
import org.mockito.ArgumentCaptor;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

public class TestUnmergeJobHandler {

    private static final UnmergeArgs ARGS = new InitialUnmergeArgs("run-1", "project", "group-1",
            new PrimaryHashUnmergeReplacement(ImmutableList.of("a")), null, 10);

    private UnmergeBatchRunner _runner;
    private JobService _jobService;
    private MetricRegistry _metricRegistry;
    private UnmergeJobHandler _handler;

    @BeforeMethod
    public void setUp() {
        _runner = mock(UnmergeBatchRunner.class);
        _jobService = mock(JobService.class);
        _metricRegistry = new MetricRegistry();
        _handler = new UnmergeJobHandler(_runner, _jobService, new UnmergeMetrics(_metricRegistry),
                3, Duration.ZERO, Duration.ZERO);
    }

    @Test
    public void testFinishedPage() throws Exception {
        when(_runner.runPage(ARGS)).thenReturn(UnmergePage.finished(4, 2));

        UnmergePageResult result = _handler.run(ARGS);

        assertTrue(result.isFinished());
        assertEquals(result.getEventsMoved(), 4);
        assertEquals(result.getEventsKept(), 2);
        verify(_jobService, never()).submitJob(any());
        assertEquals(meterCount("finished-runs"), 1);
        assertEquals(meterCount("events-moved"), 4);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testQueuesNextPage() throws Exception {
        UnmergeArgs successor = ((InitialUnmergeArgs) ARGS).withCursor("10");
        when(_runner.runPage(ARGS)).thenReturn(UnmergePage.next(successor, 0, 0));
        JobIdentifier<UnmergeArgs, UnmergePageResult> nextId = JobIdentifier.createNew(UnmergeJob.INSTANCE);
        when(_jobService.submitJob(any(JobRequest.class))).thenReturn(nextId);

        UnmergePageResult result = _handler.run(ARGS);

        assertEquals(result.getNextReference(), nextId.toString());
        ArgumentCaptor<JobRequest> request = ArgumentCaptor.forClass(JobRequest.class);
        verify(_jobService).submitJob(request.capture());
        assertSame(request.getValue().getRequest(), successor);
        assertEquals(request.getValue().getType(), UnmergeJob.INSTANCE);
        assertEquals(meterCount("pages"), 1);
    }

    @Test
    public void testRetriesTransientFailures() throws Exception {
        when(_runner.runPage(ARGS))
                .thenThrow(new TransientStoreException("timeout"))
                .thenThrow(new TransientStoreException("timeout"))
                .thenReturn(UnmergePage.finished(1, 0));

        UnmergePageResult result = _handler.run(ARGS);

        assertEquals(result.getEventsMoved(), 1);
        verify(_runner, times(3)).runPage(ARGS);
        assertEquals(meterCount("page-retries"), 2);
        assertEquals(meterCount("failed-runs"), 0);
    }

    @Test
    public void testAbortsAfterMaxAttempts() throws Exception {
        TransientStoreException failure = new TransientStoreException("unavailable");
        when(_runner.runPage(ARGS)).thenThrow(failure);

        try {
            _handler.run(ARGS);
            fail();
        } catch (UnmergeFailedException e) {
            assertEquals(e.getRunId(), "run-1");
            assertEquals(e.getAttempts(), 3);
            assertSame(e.getCause(), failure);
        }

        verify(_runner, times(3)).runPage(ARGS);
        verify(_jobService, never()).submitJob(any());
        assertEquals(meterCount("failed-runs"), 1);
    }

    @Test
    public void testDoesNotRetryOtherFailures() throws Exception {
        IllegalStateException failure = new IllegalStateException("Group group-2 is already a destination");
        when(_runner.runPage(ARGS)).thenThrow(failure);

        try {
            _handler.run(ARGS);
            fail();
        } catch (IllegalStateException e) {
            assertSame(e, failure);
        }

        verify(_runner, times(1)).runPage(ARGS);
        assertEquals(meterCount("page-retries"), 0);
        assertEquals(meterCount("failed-runs"), 1);
    }

    @Test
    public void testSingleAttempt() throws Exception {
        UnmergeJobHandler handler = new UnmergeJobHandler(_runner, _jobService, new UnmergeMetrics(new MetricRegistry()),
                1, Duration.ofMillis(10), Duration.ofMillis(100));
        when(_runner.runPage(ARGS)).thenThrow(new TransientStoreException("timeout"));

        try {
            handler.run(ARGS);
            fail();
        } catch (UnmergeFailedException e) {
            assertEquals(e.getAttempts(), 1);
        }
        verify(_runner, times(1)).runPage(ARGS);
    }

    private long meterCount(String name) {
        return _metricRegistry.meter(MetricRegistry.name("regroup.unmerge", name)).getCount();
    }
}
