package com.causalgraph.exception;

import java.util.Map;

/** An entity or relation was inserted with an id that is already stored. Not retried. */
public class DuplicateIdException extends BaseException {

    public DuplicateIdException(String resourceType, String id) {
        super(
                ErrorCode.DUPLICATE_ID,
                String.format("%s already exists with id: %s", resourceType, id),
                Map.of("resourceType", resourceType, "id", id));
    }
}
