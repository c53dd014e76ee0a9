package com.bazaarvoice.regroup.unmerge;

import com.bazaarvoice.regroup.job.api.JobHandlerRegistry;
import com.bazaarvoice.regroup.job.api.JobService;
import com.bazaarvoice.regroup.unmerge.api.ActivityLog;
import com.bazaarvoice.regroup.unmerge.api.EventSource;
import com.bazaarvoice.regroup.unmerge.api.EventStream;
import com.bazaarvoice.regroup.unmerge.api.GroupStore;
import com.bazaarvoice.regroup.unmerge.api.HashLockStore;
import com.bazaarvoice.regroup.unmerge.api.UnmergeService;
import com.bazaarvoice.regroup.unmerge.core.DefaultUnmergeService;
import com.bazaarvoice.regroup.unmerge.core.MaxPageAttempts;
import com.bazaarvoice.regroup.unmerge.core.MaxPageRetryBackoff;
import com.bazaarvoice.regroup.unmerge.core.PageRetryBackoff;
import com.bazaarvoice.regroup.unmerge.core.ReplacementPolicyFactory;
import com.bazaarvoice.regroup.unmerge.core.UnmergeBatchRunner;
import com.bazaarvoice.regroup.unmerge.core.UnmergeBatchSize;
import com.bazaarvoice.regroup.unmerge.core.UnmergeMetrics;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.PrivateModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

import java.time.Duration;

/**
 * Guice module for constructing an {@link UnmergeService}.
 * <p>
 * Requires the following external references:
 * <ul>
 * <li> {@link UnmergeConfiguration}
 * <li> {@link EventSource}
 * <li> {@link EventStream}
 * <li> {@link HashLockStore}
 * <li> {@link GroupStore}
 * <li> {@link ActivityLog}
 * <li> {@link JobService}
 * <li> {@link JobHandlerRegistry}
 * <li> {@link MetricRegistry}
 * </ul>
 * Exports the following:
 * <ul>
 * <li> {@link UnmergeService}
 * </ul>
 */
public class UnmergeModule extends PrivateModule {

    @Override
    protected void configure() {
        bind(ReplacementPolicyFactory.class).asEagerSingleton();
        bind(UnmergeBatchRunner.class).asEagerSingleton();
        bind(UnmergeMetrics.class).asEagerSingleton();

        // Registers the unmerge job handler on construction
        bind(UnmergeService.class).to(DefaultUnmergeService.class).asEagerSingleton();
        expose(UnmergeService.class);
    }

    @Provides @Singleton @UnmergeBatchSize
    protected Integer provideUnmergeBatchSize(UnmergeConfiguration configuration) {
        return configuration.getBatchSize();
    }

    @Provides @Singleton @MaxPageAttempts
    protected Integer provideMaxPageAttempts(UnmergeConfiguration configuration) {
        return configuration.getMaxPageAttempts();
    }

    @Provides @Singleton @PageRetryBackoff
    protected Duration providePageRetryBackoff(UnmergeConfiguration configuration) {
        return configuration.getRetryBackoff();
    }

    @Provides @Singleton @MaxPageRetryBackoff
    protected Duration provideMaxPageRetryBackoff(UnmergeConfiguration configuration) {
        return configuration.getMaxRetryBackoff();
    }
}
