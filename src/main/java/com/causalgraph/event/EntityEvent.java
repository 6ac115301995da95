package com.causalgraph.event;

import com.causalgraph.domain.model.TemporalEntity;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an entity enters or leaves the store.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>GraphMetricsService -- ingestion and eviction counters</li>
 *   <li>GraphArchiveService -- queues ADDED entities for write-behind persistence</li>
 * </ul>
 */
public class EntityEvent extends ApplicationEvent {

    private final String entityId;
    private final TemporalEntity entity;
    private final EntityEventType eventType;

    /**
     * @param source    the component publishing this event
     * @param entityId  id of the affected entity
     * @param entity    the entity itself for ADDED; null for EVICTED
     * @param eventType what happened
     */
    public EntityEvent(Object source, String entityId, TemporalEntity entity, EntityEventType eventType) {
        super(source);
        this.entityId = entityId;
        this.entity = entity;
        this.eventType = eventType;
    }

    public String getEntityId() {
        return entityId;
    }

    /** Null for EVICTED events; the entity is no longer stored. */
    public TemporalEntity getEntity() {
        return entity;
    }

    public EntityEventType getEventType() {
        return eventType;
    }
}
