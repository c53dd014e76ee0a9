package com.bazaarvoice.regroup.job;

import com.bazaarvoice.regroup.common.dropwizard.lifecycle.LifeCycleRegistry;
import com.bazaarvoice.regroup.common.dropwizard.lifecycle.SimpleLifeCycleRegistry;
import com.bazaarvoice.regroup.job.api.JobHandlerRegistry;
import com.bazaarvoice.regroup.job.api.JobService;
import com.bazaarvoice.regroup.job.service.DefaultJobService;
import com.bazaarvoice.regroup.queue.api.QueueService;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.apache.curator.framework.CuratorFramework;
import org.testng.annotations.Test;

import java.time.Duration;

import static org.mockito.Mockito.mock;
import static org.testng.Assert.assertNotNull;
import static org.testng.Assert.assertTrue;

public class JobModuleTest {

    @Test
    public void testJobModule() {
        Injector injector = Guice.createInjector(new AbstractModule() {
            @Override
            protected void configure() {
                binder().requireExplicitBindings();

                // construct the minimum necessary elements to allow a Job module to be created.
                bind(JobConfiguration.class).toInstance(new JobConfiguration()
                        .setConcurrencyLevel(0)
                        .setQueueRefreshTime(Duration.ofSeconds(1)));
                bind(QueueService.class).toInstance(mock(QueueService.class));
                bind(LifeCycleRegistry.class).toInstance(new SimpleLifeCycleRegistry());
                bind(CuratorFramework.class).annotatedWith(JobZooKeeper.class).toInstance(mock(CuratorFramework.class));

                install(new JobModule());
            }
        });

        assertTrue(injector.getInstance(JobService.class) instanceof DefaultJobService);
        assertNotNull(injector.getInstance(JobHandlerRegistry.class));
    }
}
