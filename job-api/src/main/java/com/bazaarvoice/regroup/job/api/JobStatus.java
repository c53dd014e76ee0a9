package com.bazaarvoice.regroup.job.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Stored state of one job.  The request travels with every status so that a job left {@code RUNNING} by a dead worker
 * can be run again from its status alone.
 */
public class JobStatus<Q, R> {

    public enum Status {
        SUBMITTED,
        RUNNING,
        FINISHED,
        FAILED;

        /** Whether a job in this state will never run again. */
        public boolean isFinal() {
            return this == FINISHED || this == FAILED;
        }
    }

    private final Status _status;
    private final Q _request;
    private final R _result;
    private final String _errorMessage;

    @JsonCreator
    public JobStatus(@JsonProperty("status") Status status,
                     @JsonProperty("request") @Nullable Q request,
                     @JsonProperty("result") @Nullable R result,
                     @JsonProperty("errorMessage") @Nullable String errorMessage) {
        _status = checkNotNull(status, "status");
        _request = request;
        _result = result;
        _errorMessage = errorMessage;
    }

    public static <Q, R> JobStatus<Q, R> submitted(@Nullable Q request) {
        return new JobStatus<>(Status.SUBMITTED, request, null, null);
    }

    public static <Q, R> JobStatus<Q, R> running(@Nullable Q request) {
        return new JobStatus<>(Status.RUNNING, request, null, null);
    }

    public static <Q, R> JobStatus<Q, R> finished(@Nullable Q request, @Nullable R result) {
        return new JobStatus<>(Status.FINISHED, request, result, null);
    }

    public static <Q, R> JobStatus<Q, R> failed(@Nullable Q request, @Nullable String errorMessage) {
        return new JobStatus<>(Status.FAILED, request, null, errorMessage);
    }

    public Status getStatus() {
        return _status;
    }

    @Nullable
    public Q getRequest() {
        return _request;
    }

    /** Set only once the job has {@link Status#FINISHED}. */
    @Nullable
    public R getResult() {
        return _result;
    }

    /** Set only once the job has {@link Status#FAILED}. */
    @Nullable
    public String getErrorMessage() {
        return _errorMessage;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("status", _status)
                .add("errorMessage", _errorMessage)
                .omitNullValues()
                .toString();
    }
}
