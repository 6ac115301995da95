package com.causalgraph.event;

import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalRelation;
import com.causalgraph.graph.EvictionResult;
import java.time.Duration;
import java.util.List;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with one factory method per
 * graph event, so call sites read {@code eventPublisherHelper.publishEntityAdded(this, entity)}.
 *
 * <p>Listeners run synchronously on the publishing thread.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Entity ----

    public void publishEntityAdded(Object source, TemporalEntity entity) {
        applicationEventPublisher.publishEvent(new EntityEvent(source, entity.getId(), entity, EntityEventType.ADDED));
    }

    public void publishEntityEvicted(Object source, String entityId) {
        applicationEventPublisher.publishEvent(new EntityEvent(source, entityId, null, EntityEventType.EVICTED));
    }

    // ---- Relation ----

    public void publishRelationAdded(Object source, TemporalRelation relation) {
        applicationEventPublisher.publishEvent(new RelationEvent(source, relation, RelationEventType.ADDED));
    }

    public void publishRelationRemoved(Object source, TemporalRelation relation) {
        applicationEventPublisher.publishEvent(new RelationEvent(source, relation, RelationEventType.REMOVED));
    }

    /** One EVICTED event per entity, then one REMOVED event per cascaded relation. */
    public void publishEviction(Object source, EvictionResult result) {
        for (String entityId : result.entityIds()) {
            publishEntityEvicted(source, entityId);
        }
        for (TemporalRelation relation : result.relations()) {
            publishRelationRemoved(source, relation);
        }
    }

    // ---- Analytics ----

    public void publishAnalytics(
            Object source, AnalyticsEventType eventType, List<?> results, Duration elapsed, long generation) {
        applicationEventPublisher.publishEvent(new AnalyticsEvent(source, eventType, results, elapsed, generation));
    }
}
