package com.bazaarvoice.regroup.job.api;

/**
 * Runs jobs of one type.  A new handler is created for every run of a job.
 * <p>
 * A job may be delivered more than once, for example when the server running it dies before its final status is
 * recorded, so running the same request again must be safe.  Any exception thrown fails the job and its message is
 * kept in the job's status.
 * @param <Q> The type for job requests
 * @param <R> The type for job responses
 */
public interface JobHandler<Q, R> {

    R run(Q request) throws Exception;
}
