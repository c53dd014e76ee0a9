package com.bazaarvoice.regroup.unmerge.core;

import com.bazaarvoice.regroup.job.api.JobHandler;
import com.bazaarvoice.regroup.job.api.JobIdentifier;
import com.bazaarvoice.regroup.job.api.JobRequest;
import com.bazaarvoice.regroup.job.api.JobService;
import com.bazaarvoice.regroup.unmerge.api.TransientStoreException;
import com.bazaarvoice.regroup.unmerge.api.UnmergeArgs;
import com.bazaarvoice.regroup.unmerge.api.UnmergeFailedException;
import com.bazaarvoice.regroup.unmerge.api.UnmergePageResult;
import dev.failsafe.Failsafe;
import dev.failsafe.RetryPolicy;
import dev.failsafe.RetryPolicyBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Runs one page of an unmerge and queues the page after it.  A page which fails on a transient store error is run
 * again from the start, with exponential backoff between attempts.  Any other failure, or running out of attempts,
 * fails the job and with it the rest of the run.
 */
public class UnmergeJobHandler implements JobHandler<UnmergeArgs, UnmergePageResult> {

    private static final Logger _log = LoggerFactory.getLogger(UnmergeJobHandler.class);

    private final UnmergeBatchRunner _runner;
    private final JobService _jobService;
    private final UnmergeMetrics _metrics;
    private final int _maxPageAttempts;
    private final Duration _retryBackoff;
    private final Duration _maxRetryBackoff;

    public UnmergeJobHandler(UnmergeBatchRunner runner, JobService jobService, UnmergeMetrics metrics,
                             int maxPageAttempts, Duration retryBackoff, Duration maxRetryBackoff) {
        _runner = requireNonNull(runner, "runner");
        _jobService = requireNonNull(jobService, "jobService");
        _metrics = requireNonNull(metrics, "metrics");
        checkArgument(maxPageAttempts > 0, "maxPageAttempts must be positive");
        _maxPageAttempts = maxPageAttempts;
        _retryBackoff = requireNonNull(retryBackoff, "retryBackoff");
        _maxRetryBackoff = requireNonNull(maxRetryBackoff, "maxRetryBackoff");
    }

    @Override
    public UnmergePageResult run(UnmergeArgs args) {
        UnmergePage page;
        try {
            page = Failsafe.with(newRetryPolicy(args)).get(() -> _runner.runPage(args));
        } catch (TransientStoreException e) {
            _metrics.runFailed();
            _log.error("Unmerge {} of group {} failed at cursor {} after {} attempts",
                    args.getRunId(), args.getSourceId(), args.getCursor(), _maxPageAttempts, e);
            throw new UnmergeFailedException(args.getRunId(), _maxPageAttempts, e);
        } catch (RuntimeException e) {
            _metrics.runFailed();
            throw e;
        }

        _metrics.pageCompleted(page);

        if (page.isFinished()) {
            return new UnmergePageResult(page.getEventsMoved(), page.getEventsKept(), null);
        }

        JobIdentifier<UnmergeArgs, UnmergePageResult> next =
                _jobService.submitJob(new JobRequest<>(UnmergeJob.INSTANCE, page.getSuccessor()));
        _log.debug("Unmerge {} queued page {}", args.getRunId(), next);

        return new UnmergePageResult(page.getEventsMoved(), page.getEventsKept(), next.toString());
    }

    private RetryPolicy<UnmergePage> newRetryPolicy(final UnmergeArgs args) {
        RetryPolicyBuilder<UnmergePage> builder = RetryPolicy.<UnmergePage>builder()
                .handle(TransientStoreException.class)
                .withMaxAttempts(_maxPageAttempts)
                .onRetry(event -> {
                    _metrics.pageRetried();
                    _log.warn("Retrying page at cursor {} of unmerge {} after attempt {} failed: {}",
                            args.getCursor(), args.getRunId(), event.getAttemptCount(),
                            event.getLastException().toString());
                });

        if (!_retryBackoff.isZero()) {
            if (_maxRetryBackoff.compareTo(_retryBackoff) > 0) {
                builder.withBackoff(_retryBackoff, _maxRetryBackoff);
            } else {
                builder.withDelay(_retryBackoff);
            }
        }
        return builder.build();
    }
}
