package com.bazaarvoice.regroup.job.api;

import java.util.function.Supplier;

public interface JobHandlerRegistry {

    /**
     * Registers how jobs of the type are run, replacing any earlier registration for the type.  The supplier is
     * called once per job run.
     */
    <Q, R> void addHandler(JobType<Q, R> jobType, Supplier<? extends JobHandler<Q, R>> handlerSupplier);
}
