package com.causalgraph.event;

import java.time.Duration;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published after an analytics run has replaced its published result.
 *
 * <p>The payload is the new result list (hypotheses, chains, patterns or predictions,
 * depending on the type), so listeners never need to call back into the service.
 */
public class AnalyticsEvent extends ApplicationEvent {

    private final AnalyticsEventType eventType;
    private final List<?> results;
    private final Duration elapsed;
    private final long generation;

    /**
     * @param results    the published result, unmodifiable
     * @param elapsed    wall time of the run
     * @param generation graph generation of the snapshot the run worked on
     */
    public AnalyticsEvent(
            Object source, AnalyticsEventType eventType, List<?> results, Duration elapsed, long generation) {
        super(source);
        this.eventType = eventType;
        this.results = results;
        this.elapsed = elapsed;
        this.generation = generation;
    }

    public AnalyticsEventType getEventType() {
        return eventType;
    }

    public List<?> getResults() {
        return results;
    }

    public int getResultCount() {
        return results.size();
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public long getGeneration() {
        return generation;
    }
}
