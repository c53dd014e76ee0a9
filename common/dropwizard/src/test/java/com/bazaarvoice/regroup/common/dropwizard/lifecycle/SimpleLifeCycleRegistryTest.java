package com.bazaarvoice.regroup.common.dropwizard.lifecycle;

import io.dropwizard.lifecycle.Managed;
import org.mockito.InOrder;
import org.testng.annotations.Test;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.fail;

public class SimpleLifeCycleRegistryTest {

    @Test
    public void testStartsInOrderAndStopsInReverse() throws Exception {
        Managed first = mock(Managed.class);
        Managed second = mock(Managed.class);

        SimpleLifeCycleRegistry registry = new SimpleLifeCycleRegistry();
        registry.manage(first);
        registry.manage(second);

        registry.start();
        registry.stop();

        InOrder inOrder = inOrder(first, second);
        inOrder.verify(first).start();
        inOrder.verify(second).start();
        inOrder.verify(second).stop();
        inOrder.verify(first).stop();
    }

    @Test
    public void testCloseStopsEverythingStarted() throws Exception {
        Managed managed = mock(Managed.class);

        SimpleLifeCycleRegistry registry = new SimpleLifeCycleRegistry();
        registry.manage(managed);
        registry.start();
        registry.close();
        registry.close();

        verify(managed).stop();
    }

    @Test
    public void testFailedStopDoesNotSkipTheRest() throws Exception {
        Managed first = mock(Managed.class);
        Managed second = mock(Managed.class);
        IllegalStateException failure = new IllegalStateException("stuck");
        doThrow(failure).when(second).stop();

        SimpleLifeCycleRegistry registry = new SimpleLifeCycleRegistry();
        registry.manage(first);
        registry.manage(second);
        registry.start();

        try {
            registry.stop();
            fail("Expected the failed stop to be reported");
        } catch (IllegalStateException e) {
            assertSame(e, failure);
        }
        verify(first).stop();
    }

    @Test
    public void testOnlyStartedObjectsAreStopped() throws Exception {
        Managed first = mock(Managed.class);
        Managed second = mock(Managed.class);
        doThrow(new IllegalStateException("no")).when(first).start();

        SimpleLifeCycleRegistry registry = new SimpleLifeCycleRegistry();
        registry.manage(first);
        registry.manage(second);

        try {
            registry.start();
            fail("Expected the failed start to be reported");
        } catch (IllegalStateException e) {
            registry.stop();
        }

        verify(second, never()).start();
        verify(first, never()).stop();
        verify(second, never()).stop();
    }
}
