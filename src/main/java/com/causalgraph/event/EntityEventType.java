package com.causalgraph.event;

/**
 * Classifies the change that triggered an {@link EntityEvent}.
 */
public enum EntityEventType {

    /** The entity was inserted into the store. */
    ADDED,

    /** The entity was removed by retention or by the capacity cap. */
    EVICTED
}
