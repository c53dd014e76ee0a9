package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.job.api.JobHandlerRegistry;
import com.bazaarvoice.regroup.job.api.JobIdentifier;
import com.bazaarvoice.regroup.job.api.JobRequest;
import com.bazaarvoice.regroup.job.api.JobService;
import com.bazaarvoice.regroup.job.api.JobStatus;
import com.bazaarvoice.regroup.unmerge.api.HierarchicalUnmergeReplacement;
import com.bazaarvoice.regroup.unmerge.api.InitialUnmergeArgs;
import com.bazaarvoice.regroup.unmerge.api.PrimaryHashUnmergeReplacement;
import com.bazaarvoice.regroup.unmerge.api.UnknownUnmergeException;
import com.bazaarvoice.regroup.unmerge.api.UnmergeArgs;
import com.bazaarvoice.regroup.unmerge.api.UnmergeDestination;
import com.bazaarvoice.regroup.unmerge.api.UnmergePageResult;
import com.bazaarvoice.regroup.unmerge.api.UnmergeReplacementVisitor;
import com.bazaarvoice.regroup.unmerge.api.UnmergeRequest;
import com.bazaarvoice.regroup.unmerge.api.UnmergeService;
import com.bazaarvoice.regroup.unmerge.api.UnmergeStatus;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

public class DefaultUnmergeService implements UnmergeService {

    private static final Logger _log = LoggerFactory.getLogger(DefaultUnmergeService.class);

    private final JobService _jobService;
    private final int _defaultBatchSize;

    @Inject
    public DefaultUnmergeService(JobService jobService, JobHandlerRegistry jobHandlerRegistry,
                                 final UnmergeBatchRunner runner, final UnmergeMetrics metrics,
                                 @UnmergeBatchSize Integer defaultBatchSize,
                                 @MaxPageAttempts final Integer maxPageAttempts,
                                 @PageRetryBackoff final Duration retryBackoff,
                                 @MaxPageRetryBackoff final Duration maxRetryBackoff) {
        _jobService = checkNotNull(jobService, "jobService");
        _defaultBatchSize = checkNotNull(defaultBatchSize, "defaultBatchSize");
        checkNotNull(runner, "runner");
        checkNotNull(metrics, "metrics");
        checkNotNull(maxPageAttempts, "maxPageAttempts");
        checkNotNull(retryBackoff, "retryBackoff");
        checkNotNull(maxRetryBackoff, "maxRetryBackoff");

        checkNotNull(jobHandlerRegistry, "jobHandlerRegistry");
        jobHandlerRegistry.addHandler(UnmergeJob.INSTANCE,
                () -> new UnmergeJobHandler(runner, _jobService, metrics, maxPageAttempts, retryBackoff, maxRetryBackoff));
    }

    @Override
    public String unmerge(UnmergeRequest request) {
        checkNotNull(request, "request");
        int batchSize = request.getBatchSize() != null ? request.getBatchSize() : _defaultBatchSize;
        checkArgument(batchSize > 0, "batchSize must be positive");

        String runId = UUID.randomUUID().toString();
        InitialUnmergeArgs args = new InitialUnmergeArgs(runId, request.getProjectId(), request.getSourceId(),
                request.getReplacement(), request.getActorId(), batchSize, getRequestedDestinations(request), null);

        JobIdentifier<UnmergeArgs, UnmergePageResult> jobId =
                _jobService.submitJob(new JobRequest<>(UnmergeJob.INSTANCE, args));

        _log.info("Submitted unmerge {} of group {} in project {}: {}",
                runId, request.getSourceId(), request.getProjectId(), jobId);
        return jobId.toString();
    }

    private Map<String, UnmergeDestination> getRequestedDestinations(final UnmergeRequest request) {
        if (request.getDestinationId() == null) {
            return ImmutableMap.of();
        }
        return request.getReplacement().visit(new UnmergeReplacementVisitor<Map<String, UnmergeDestination>>() {
            @Override
            public Map<String, UnmergeDestination> visit(PrimaryHashUnmergeReplacement replacement) {
                return ImmutableMap.of(PrimaryHashUnmergeReplacement.DEFAULT_UNMERGE_KEY,
                        new UnmergeDestination(request.getDestinationId(), null));
            }

            @Override
            public Map<String, UnmergeDestination> visit(HierarchicalUnmergeReplacement replacement) {
                throw new IllegalArgumentException("A hierarchical unmerge cannot move events into an existing group");
            }
        });
    }

    @Override
    public UnmergeStatus getStatus(String reference) {
        checkNotNull(reference, "reference");

        JobIdentifier<UnmergeArgs, UnmergePageResult> jobId = parseReference(reference);
        int pagesCompleted = 0;
        long eventsMoved = 0;

        // Follow the run from the referenced page to its most recent one
        while (true) {
            JobStatus<UnmergeArgs, UnmergePageResult> status = _jobService.getJobStatus(jobId);
            if (status == null) {
                if (pagesCompleted == 0) {
                    throw new UnknownUnmergeException(reference);
                }
                return new UnmergeStatus(reference, jobId.toString(), UnmergeStatus.Status.IN_PROGRESS,
                        pagesCompleted, eventsMoved, null);
            }

            switch (status.getStatus()) {
                case SUBMITTED:
                case RUNNING:
                    return new UnmergeStatus(reference, jobId.toString(), UnmergeStatus.Status.IN_PROGRESS,
                            pagesCompleted, eventsMoved, null);

                case FAILED:
                    return new UnmergeStatus(reference, jobId.toString(), UnmergeStatus.Status.ERROR,
                            pagesCompleted, eventsMoved, status.getErrorMessage());

                default:
                    UnmergePageResult result = status.getResult();
                    if (result == null) {
                        throw new IllegalStateException("Unmerge page result not found: " + jobId);
                    }
                    pagesCompleted += 1;
                    eventsMoved += result.getEventsMoved();
                    if (result.isFinished()) {
                        return new UnmergeStatus(reference, jobId.toString(), UnmergeStatus.Status.COMPLETE,
                                pagesCompleted, eventsMoved, null);
                    }
                    jobId = JobIdentifier.fromString(result.getNextReference(), UnmergeJob.INSTANCE);
            }
        }
    }

    private JobIdentifier<UnmergeArgs, UnmergePageResult> parseReference(String reference) {
        try {
            return JobIdentifier.fromString(reference, UnmergeJob.INSTANCE);
        } catch (IllegalArgumentException e) {
            // The reference is illegal and therefore cannot match any unmerge pages.
            throw new UnknownUnmergeException(reference);
        }
    }
}
