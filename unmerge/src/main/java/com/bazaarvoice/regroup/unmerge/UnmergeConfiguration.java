package com.bazaarvoice.regroup.unmerge;

import com.bazaarvoice.regroup.unmerge.api.UnmergeArgs;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

public class UnmergeConfiguration {

    private final static int DEFAULT_MAX_PAGE_ATTEMPTS = 3;
    private final static Duration DEFAULT_RETRY_BACKOFF = Duration.ofMillis(100);
    private final static Duration DEFAULT_MAX_RETRY_BACKOFF = Duration.ofSeconds(5);

    // Number of events fetched from the source group per page when a request doesn't override it
    @Min(1)
    @JsonProperty("batchSize")
    private int _batchSize = UnmergeArgs.DEFAULT_BATCH_SIZE;
    // Attempts per page before a transient store failure aborts the run
    @Min(1)
    @JsonProperty("maxPageAttempts")
    private int _maxPageAttempts = DEFAULT_MAX_PAGE_ATTEMPTS;
    @NotNull
    @JsonProperty("retryBackoff")
    private Duration _retryBackoff = DEFAULT_RETRY_BACKOFF;
    @NotNull
    @JsonProperty("maxRetryBackoff")
    private Duration _maxRetryBackoff = DEFAULT_MAX_RETRY_BACKOFF;

    public int getBatchSize() {
        return _batchSize;
    }

    public UnmergeConfiguration setBatchSize(int batchSize) {
        _batchSize = batchSize;
        return this;
    }

    public int getMaxPageAttempts() {
        return _maxPageAttempts;
    }

    public UnmergeConfiguration setMaxPageAttempts(int maxPageAttempts) {
        _maxPageAttempts = maxPageAttempts;
        return this;
    }

    public Duration getRetryBackoff() {
        return _retryBackoff;
    }

    public UnmergeConfiguration setRetryBackoff(Duration retryBackoff) {
        _retryBackoff = requireNonNull(retryBackoff, "retryBackoff");
        return this;
    }

    public Duration getMaxRetryBackoff() {
        return _maxRetryBackoff;
    }

    public UnmergeConfiguration setMaxRetryBackoff(Duration maxRetryBackoff) {
        _maxRetryBackoff = requireNonNull(maxRetryBackoff, "maxRetryBackoff");
        return this;
    }
}
