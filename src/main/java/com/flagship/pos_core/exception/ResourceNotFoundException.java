package com.flagship.pos_core.exception;

import java.util.UUID;

/**
 * Referenced record does not exist within the caller's business.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String resource, UUID id) {
        super(resource + " not found: " + id);
    }
}
