package com.causalgraph.exception;

import java.util.Map;

/** A relation references an endpoint that is not in the entity store. */
public class UnknownEntityException extends BaseException {

    public UnknownEntityException(String relationId, String entityId) {
        super(
                ErrorCode.UNKNOWN_ENTITY,
                String.format("Relation %s references unknown entity: %s", relationId, entityId),
                Map.of("relationId", relationId, "entityId", entityId));
    }
}
