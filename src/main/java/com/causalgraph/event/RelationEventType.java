package com.causalgraph.event;

public enum RelationEventType {
    ADDED,

    /** Dropped because one of its endpoints was evicted. */
    REMOVED
}
