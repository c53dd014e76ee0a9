package com.bazaarvoice.regroup.job;

import com.fasterxml.jackson.annotation.JsonProperty;

import javax.validation.constraints.Min;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

public class JobConfiguration {

    private final static int DEFAULT_CONCURRENCY_LEVEL = 2;
    private final static Duration DEFAULT_QUEUE_REFRESH_TIME = Duration.ofSeconds(10);
    private final static int DEFAULT_QUEUE_PEEK_LIMIT = 100;

    // Number of jobs that can be run concurrently (job thread pool size).  Zero disables job processing.
    @Min(0)
    @JsonProperty("concurrencyLevel")
    private int _concurrencyLevel = DEFAULT_CONCURRENCY_LEVEL;
    // How long the head of the queue should be cached locally before refreshing
    @JsonProperty("queueRefreshTime")
    private Duration _queueRefreshTime = DEFAULT_QUEUE_REFRESH_TIME;
    // Maximum number of entries to peek from the queue on each refresh
    @Min(1)
    @JsonProperty("queuePeekLimit")
    private int _queuePeekLimit = DEFAULT_QUEUE_PEEK_LIMIT;

    public int getConcurrencyLevel() {
        return _concurrencyLevel;
    }

    public JobConfiguration setConcurrencyLevel(int concurrencyLevel) {
        _concurrencyLevel = concurrencyLevel;
        return this;
    }

    public Duration getQueueRefreshTime() {
        return _queueRefreshTime;
    }

    public JobConfiguration setQueueRefreshTime(Duration queueRefreshTime) {
        _queueRefreshTime = requireNonNull(queueRefreshTime, "queueRefreshTime");
        return this;
    }

    public int getQueuePeekLimit() {
        return _queuePeekLimit;
    }

    public JobConfiguration setQueuePeekLimit(int queuePeekLimit) {
        _queuePeekLimit = queuePeekLimit;
        return this;
    }
}
