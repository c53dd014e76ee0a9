package com.bazaarvoice.regroup.job.handler;

import com.bazaarvoice.regroup.job.api.JobHandler;
import com.bazaarvoice.regroup.job.api.JobHandlerRegistry;
import com.bazaarvoice.regroup.job.api.JobType;
import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Handlers keyed by job type name, which is the form in which a type arrives with a queued job id.
 */
public class DefaultJobHandlerRegistry implements JobHandlerRegistry {

    private static final Logger _log = LoggerFactory.getLogger(DefaultJobHandlerRegistry.class);

    private final Map<String, Registration<?, ?>> _registrations = Maps.newConcurrentMap();

    @Override
    public <Q, R> void addHandler(JobType<Q, R> jobType, Supplier<? extends JobHandler<Q, R>> handlerSupplier) {
        checkNotNull(jobType, "jobType");
        checkNotNull(handlerSupplier, "handlerSupplier");
        if (_registrations.put(jobType.getName(), new Registration<>(jobType, handlerSupplier)) != null) {
            _log.warn("Replaced the handler for job type {}", jobType);
        }
    }

    @Nullable
    public Registration<?, ?> getRegistration(String jobTypeName) {
        checkNotNull(jobTypeName, "jobTypeName");
        return _registrations.get(jobTypeName);
    }

    /** A job type paired with the factory for its handlers. */
    public static final class Registration<Q, R> {
        private final JobType<Q, R> _jobType;
        private final Supplier<? extends JobHandler<Q, R>> _handlerSupplier;

        private Registration(JobType<Q, R> jobType, Supplier<? extends JobHandler<Q, R>> handlerSupplier) {
            _jobType = jobType;
            _handlerSupplier = handlerSupplier;
        }

        public JobType<Q, R> getJobType() {
            return _jobType;
        }

        /** Handlers hold per-run state, so every run gets its own. */
        public JobHandler<Q, R> newHandler() {
            return checkNotNull(_handlerSupplier.get(), "handler");
        }
    }
}
