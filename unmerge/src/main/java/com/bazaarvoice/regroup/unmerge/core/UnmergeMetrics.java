package com.bazaarvoice.regroup.unmerge.core;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.Inject;

public class UnmergeMetrics {

    private final Meter _pages;
    private final Meter _eventsMoved;
    private final Meter _eventsKept;
    private final Meter _pageRetries;
    private final Meter _failedRuns;
    private final Meter _finishedRuns;

    @Inject
    public UnmergeMetrics(MetricRegistry metricRegistry) {
        _pages = newMeter("pages", metricRegistry);
        _eventsMoved = newMeter("events-moved", metricRegistry);
        _eventsKept = newMeter("events-kept", metricRegistry);
        _pageRetries = newMeter("page-retries", metricRegistry);
        _failedRuns = newMeter("failed-runs", metricRegistry);
        _finishedRuns = newMeter("finished-runs", metricRegistry);
    }

    void pageCompleted(UnmergePage page) {
        _pages.mark();
        _eventsMoved.mark(page.getEventsMoved());
        _eventsKept.mark(page.getEventsKept());
        if (page.isFinished()) {
            _finishedRuns.mark();
        }
    }

    void pageRetried() {
        _pageRetries.mark();
    }

    void runFailed() {
        _failedRuns.mark();
    }

    private Meter newMeter(String name, MetricRegistry metricRegistry) {
        return metricRegistry.meter(MetricRegistry.name("regroup.unmerge", name));
    }
}
