package com.bazaarvoice.regroup.job;

import com.bazaarvoice.regroup.common.dropwizard.lifecycle.LifeCycleRegistry;
import com.bazaarvoice.regroup.job.api.JobHandlerRegistry;
import com.bazaarvoice.regroup.job.api.JobService;
import com.bazaarvoice.regroup.job.dao.JobStatusDAO;
import com.bazaarvoice.regroup.job.dao.JobStatusRootPath;
import com.bazaarvoice.regroup.job.dao.ZooKeeperJobStatusDAO;
import com.bazaarvoice.regroup.job.handler.DefaultJobHandlerRegistry;
import com.bazaarvoice.regroup.job.service.DefaultJobService;
import com.bazaarvoice.regroup.job.service.JobConcurrencyLevel;
import com.bazaarvoice.regroup.job.service.JobQueueName;
import com.bazaarvoice.regroup.job.service.QueuePeekLimit;
import com.bazaarvoice.regroup.job.service.QueueRefreshTime;
import com.bazaarvoice.regroup.queue.api.QueueService;
import com.google.inject.PrivateModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.apache.curator.framework.CuratorFramework;

import java.time.Duration;

/**
 * Guice module for constructing a {@link JobService}.
 * <p>
 * Requires the following external references:
 * <ul>
 * <li> {@link JobConfiguration}
 * <li> {@link QueueService}
 * <li> {@link LifeCycleRegistry}
 * <li> @{@link JobZooKeeper} {@link CuratorFramework}
 * </ul>
 * Exports the following:
 * <ul>
 * <li> {@link JobService}
 * <li> {@link JobHandlerRegistry}
 * </ul>
 */
public class JobModule extends PrivateModule {

    private final static String QUEUE_NAME = "regroup:job";
    private final static String JOB_STATUS_ROOT_PATH = "/regroup/job-status";

    @Override
    protected void configure() {
        bind(String.class).annotatedWith(JobQueueName.class).toInstance(QUEUE_NAME);
        bind(String.class).annotatedWith(JobStatusRootPath.class).toInstance(JOB_STATUS_ROOT_PATH);

        bind(JobStatusDAO.class).to(ZooKeeperJobStatusDAO.class).asEagerSingleton();
        bind(DefaultJobHandlerRegistry.class).asEagerSingleton();
        bind(JobHandlerRegistry.class).to(DefaultJobHandlerRegistry.class);
        bind(JobService.class).to(DefaultJobService.class).asEagerSingleton();

        expose(JobService.class);
        expose(JobHandlerRegistry.class);
    }

    @Provides @Singleton @JobConcurrencyLevel
    protected Integer provideJobConcurrencyLevel(JobConfiguration configuration) {
        return configuration.getConcurrencyLevel();
    }

    @Provides @Singleton @QueueRefreshTime
    protected Duration provideQueueRefreshTime(JobConfiguration configuration) {
        return configuration.getQueueRefreshTime();
    }

    @Provides @Singleton @QueuePeekLimit
    protected Integer provideQueuePeekLimit(JobConfiguration configuration) {
        return configuration.getQueuePeekLimit();
    }
}
