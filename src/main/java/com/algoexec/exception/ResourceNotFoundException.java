package com.algoexec.exception;

import java.util.Map;

/** A portfolio entry requested over REST that the engine does not hold. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                "No " + resourceType + " for " + identifier,
                Map.of("resource", resourceType, "id", identifier));
    }
}
