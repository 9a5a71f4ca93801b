package com.z254.swarm.hive.domain;

/**
 * Base class of the exceptions thrown synchronously by registry and lifecycle operations.
 * The REST layer maps subclasses to 4xx responses.
 */
public class HiveException extends RuntimeException {

    public HiveException(String message) {
        super(message);
    }

    public HiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
