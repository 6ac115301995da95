package com.causalgraph.event;

import com.causalgraph.domain.model.TemporalRelation;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a relation is added (by a client or by hypothesis promotion) or removed by
 * an eviction cascade.
 */
public class RelationEvent extends ApplicationEvent {

    private final TemporalRelation relation;
    private final RelationEventType eventType;

    public RelationEvent(Object source, TemporalRelation relation, RelationEventType eventType) {
        super(source);
        this.relation = relation;
        this.eventType = eventType;
    }

    public TemporalRelation getRelation() {
        return relation;
    }

    public RelationEventType getEventType() {
        return eventType;
    }
}
