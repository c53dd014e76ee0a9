package com.bazaarvoice.regroup.job.service;

import com.bazaarvoice.regroup.common.dropwizard.lifecycle.LifeCycleRegistry;
import com.bazaarvoice.regroup.job.JobZooKeeper;
import com.bazaarvoice.regroup.job.api.JobIdentifier;
import com.bazaarvoice.regroup.job.api.JobRequest;
import com.bazaarvoice.regroup.job.api.JobService;
import com.bazaarvoice.regroup.job.api.JobStatus;
import com.bazaarvoice.regroup.job.dao.JobStatusDAO;
import com.bazaarvoice.regroup.job.handler.DefaultJobHandlerRegistry;
import com.bazaarvoice.regroup.queue.api.Message;
import com.bazaarvoice.regroup.queue.api.QueueService;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Queues;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.dropwizard.lifecycle.Managed;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.recipes.locks.InterProcessMutex;
import org.apache.curator.utils.ZKPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.bazaarvoice.regroup.job.api.JobIdentifier.getJobTypeNameFromId;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Job service which drains a shared queue of job ids.  Each job is guarded by a ZooKeeper mutex so that, across all
 * servers draining the queue, a given job runs on at most one worker at a time.  A job's queue message is only
 * acknowledged once the job has a final status, so a worker that dies mid-job leaves the message for another worker,
 * which finds the job still {@code RUNNING} and runs it again.
 */
public class DefaultJobService implements JobService, Managed {

    private static final Logger _log = LoggerFactory.getLogger(DefaultJobService.class);

    private static final String MUTEX_PATH = "/leader";
    private static final long MUTEX_WAIT_MILLIS = 200;
    private static final long IDLE_SECONDS = 5;

    private final QueueService _queueService;
    private final String _queueName;
    private final DefaultJobHandlerRegistry _handlers;
    private final JobStatusDAO _statuses;
    private final CuratorFramework _curator;
    private final int _workers;
    private final Supplier<Queue<Message>> _pending;
    private ScheduledExecutorService _executor;
    private volatile boolean _stopped;

    @Inject
    public DefaultJobService(LifeCycleRegistry lifeCycleRegistry,
                             QueueService queueService,
                             @JobQueueName String queueName,
                             DefaultJobHandlerRegistry handlers,
                             JobStatusDAO statuses,
                             @JobZooKeeper CuratorFramework curator,
                             @JobConcurrencyLevel Integer workers,
                             @QueueRefreshTime Duration queueRefreshTime,
                             @QueuePeekLimit final Integer queuePeekLimit) {
        _queueService = checkNotNull(queueService, "queueService");
        _queueName = checkNotNull(queueName, "queueName");
        _handlers = checkNotNull(handlers, "handlers");
        _statuses = checkNotNull(statuses, "statuses");
        _curator = checkNotNull(curator, "curator");
        _workers = checkNotNull(workers, "workers");
        checkArgument(_workers >= 0, "Concurrency level cannot be negative");
        checkNotNull(queuePeekLimit, "queuePeekLimit");
        checkNotNull(queueRefreshTime, "queueRefreshTime");

        // Workers share one local copy of the queue head, reloaded at most once per refresh period
        Supplier<Queue<Message>> peek =
                () -> Queues.synchronizedQueue(Queues.newArrayDeque(_queueService.peek(_queueName, queuePeekLimit)));
        _pending = queueRefreshTime.isZero()
                ? peek
                : Suppliers.memoizeWithExpiration(peek, queueRefreshTime.toMillis(), TimeUnit.MILLISECONDS);

        checkNotNull(lifeCycleRegistry, "lifeCycleRegistry").manage(this);
    }

    @Override
    public void start() {
        if (_workers == 0) {
            _log.info("Job processing has been disabled");
            return;
        }

        _executor = Executors.newScheduledThreadPool(_workers,
                new ThreadFactoryBuilder().setNameFormat("job-%d").build());
        for (int i = 0; i < _workers; i++) {
            _executor.scheduleWithFixedDelay(this::drain, IDLE_SECONDS, IDLE_SECONDS, TimeUnit.SECONDS);
        }
    }

    @Override
    public void stop() {
        _stopped = true;
        if (_executor != null) {
            _executor.shutdownNow();
            _executor = null;
        }
    }

    private void drain() {
        while (!_stopped && runNextJob()) {
            // keep going until the queue has nothing this worker can claim
        }
    }

    @Override
    public <Q, R> JobIdentifier<Q, R> submitJob(JobRequest<Q, R> jobRequest) {
        checkNotNull(jobRequest, "jobRequest");
        checkArgument(_handlers.getRegistration(jobRequest.getType().getName()) != null,
                "Cannot handle job of type %s", jobRequest.getType());

        JobIdentifier<Q, R> jobId = JobIdentifier.createNew(jobRequest.getType());

        // Stored before queueing; a worker must never dequeue a job it can't find
        _statuses.updateJobStatus(jobId, JobStatus.<Q, R>submitted(jobRequest.getRequest()));
        _queueService.send(_queueName, jobId.toString());

        _log.debug("Submitted job {}", jobId);
        return jobId;
    }

    @Override
    public <Q, R> JobStatus<Q, R> getJobStatus(JobIdentifier<Q, R> id) {
        return _statuses.getJobStatus(checkNotNull(id, "id"));
    }

    /**
     * Claims the first queued job whose mutex is free and runs it.
     * @return True if a job was claimed, false if every queued job was empty or held by another worker.
     */
    @VisibleForTesting
    boolean runNextJob() {
        try {
            Queue<Message> pending = _pending.get();
            Message message;
            while ((message = pending.poll()) != null) {
                String jobId = (String) message.getPayload();
                InterProcessMutex mutex = new InterProcessMutex(_curator, ZKPaths.makePath(MUTEX_PATH, jobId));
                if (!mutex.acquire(MUTEX_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                    _log.debug("Job {} is held by another worker", jobId);
                    continue;
                }
                try {
                    _log.info("Executing job {}...", jobId);
                    execute(jobId, _handlers.getRegistration(getJobTypeNameFromId(jobId)));
                    acknowledge(message);
                    _log.info("Executing job {}... DONE", jobId);
                } finally {
                    mutex.release();
                }
                return true;
            }
        } catch (Throwable t) {
            _log.warn("Unable to claim the next job", t);
        }
        return false;
    }

    private <Q, R> void execute(String id, DefaultJobHandlerRegistry.Registration<Q, R> registration) {
        if (registration == null) {
            // Nothing on this server can read the job's status, so it stays as it is
            _log.error("No handler for job {} of type {}", id, getJobTypeNameFromId(id));
            return;
        }

        JobIdentifier<Q, R> jobId = JobIdentifier.fromString(id, registration.getJobType());
        JobStatus<Q, R> status;
        try {
            status = _statuses.getJobStatus(jobId);
        } catch (IllegalArgumentException e) {
            // The stored request no longer parses, which no retry will fix
            _log.error("Unreadable status for job {}", jobId, e);
            recordFinalStatus(jobId, JobStatus.<Q, R>failed(null, e.getMessage()));
            return;
        }

        if (status == null) {
            _log.warn("Job {} has no status and can't be run", jobId);
            return;
        }
        if (status.getStatus().isFinal()) {
            _log.info("Job {} has already run", jobId);
            return;
        }
        if (status.getStatus() == JobStatus.Status.RUNNING) {
            // The worker which marked it died before recording a final status
            _log.info("Job {} was left running and will be run again", jobId);
        }

        Q request = status.getRequest();
        try {
            _statuses.updateJobStatus(jobId, JobStatus.<Q, R>running(request));
            R result = registration.newHandler().run(request);
            recordFinalStatus(jobId, JobStatus.finished(request, result));
        } catch (Exception e) {
            _log.error("Job {} failed", jobId, e);
            recordFinalStatus(jobId, JobStatus.<Q, R>failed(request, e.getMessage()));
        }
    }

    /** Logs rather than throws; the queue message is acknowledged either way. */
    private <Q, R> void recordFinalStatus(JobIdentifier<Q, R> jobId, JobStatus<Q, R> status) {
        try {
            _statuses.updateJobStatus(jobId, status);
        } catch (Exception e) {
            _log.error("Failed to record status {} for job {}", status.getStatus(), jobId, e);
        }
    }

    private void acknowledge(Message message) {
        try {
            _queueService.acknowledge(_queueName, ImmutableList.of(message.getId()));
        } catch (Exception e) {
            _log.error("Failed to acknowledge message {}", message.getId(), e);
        }
    }
}
