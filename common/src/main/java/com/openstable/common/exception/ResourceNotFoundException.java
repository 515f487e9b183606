package com.openstable.common.exception;

/**
 * Thrown when a mutation targets an entity that is not present in the synchronized view.
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String collection, Object identifier) {
        super(String.format("Entity %s not found in collection %s", identifier, collection), "RESOURCE_NOT_FOUND");
    }
}
