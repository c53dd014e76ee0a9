package com.bazaarvoice.regroup.job.api;

import javax.annotation.Nullable;

import static java.util.Objects.requireNonNull;

/** A request waiting to be submitted as a job of the given type. */
public final class JobRequest<Q, R> {

    private final JobType<Q, R> _type;
    private final Q _request;

    public JobRequest(JobType<Q, R> type, @Nullable Q request) {
        _type = requireNonNull(type, "type");
        _request = request;
    }

    public JobType<Q, R> getType() {
        return _type;
    }

    @Nullable
    public Q getRequest() {
        return _request;
    }

    @Override
    public String toString() {
        return _type + "(" + _request + ")";
    }
}
