package com.bazaarvoice.regroup.common.dropwizard.lifecycle;

import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import io.dropwizard.lifecycle.Managed;

import java.io.Closeable;
import java.io.IOException;
import java.util.Deque;
import java.util.List;

/**
 * {@link LifeCycleRegistry} for use outside a Dropwizard environment, in tools and tests.  Objects start in the order
 * they were registered.  Stopping only touches the ones that started, newest first, and carries on past failures so
 * that one bad stop can't leave a ZooKeeper client open.
 */
public class SimpleLifeCycleRegistry implements LifeCycleRegistry, Managed, Closeable {

    private final List<Managed> _registered = Lists.newArrayList();
    private final Deque<Managed> _started = Lists.newLinkedList();

    @Override
    public synchronized <T extends Managed> T manage(T managed) {
        _registered.add(managed);
        return managed;
    }

    @Override
    public synchronized void start() throws Exception {
        for (Managed managed : _registered) {
            if (!_started.contains(managed)) {
                managed.start();
                _started.push(managed);
            }
        }
    }

    @Override
    public synchronized void stop() throws Exception {
        Exception failure = null;
        while (!_started.isEmpty()) {
            Managed managed = _started.pop();
            try {
                managed.stop();
            } catch (Exception e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void close() throws IOException {
        try {
            stop();
        } catch (Exception e) {
            Throwables.throwIfInstanceOf(e, IOException.class);
            Throwables.throwIfUnchecked(e);
            throw new IOException(e);
        }
    }
}
