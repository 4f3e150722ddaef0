package com.ledgerlens.categorizer.common;

/**
 * A referenced resource does not exist or is not owned by the calling user.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
