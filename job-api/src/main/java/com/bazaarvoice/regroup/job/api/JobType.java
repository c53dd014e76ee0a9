package com.bazaarvoice.regroup.job.api;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A kind of job, named by a string which is stored inside every {@link JobIdentifier} of the type.  Renaming a type
 * orphans the jobs queued under the old name.  Types are usually singletons.
 * @param <Q> The request stored with each job
 * @param <R> The result recorded when a job finishes
 */
public abstract class JobType<Q, R> {

    private final String _name;
    private final Class<Q> _requestType;
    private final Class<R> _resultType;

    protected JobType(String name, Class<Q> requestType, Class<R> resultType) {
        checkArgument(!requireNonNull(name, "name").isEmpty(), "Job type names cannot be empty");
        _name = name;
        _requestType = requireNonNull(requestType, "requestType");
        _resultType = requireNonNull(resultType, "resultType");
    }

    public String getName() {
        return _name;
    }

    /** Class the stored request is read back as. */
    public Class<Q> getRequestType() {
        return _requestType;
    }

    /** Class the stored result is read back as. */
    public Class<R> getResultType() {
        return _resultType;
    }

    @Override
    public boolean equals(Object other) {
        return other == this || (other instanceof JobType && _name.equals(((JobType<?, ?>) other)._name));
    }

    @Override
    public int hashCode() {
        return _name.hashCode();
    }

    @Override
    public String toString() {
        return _name;
    }
}
