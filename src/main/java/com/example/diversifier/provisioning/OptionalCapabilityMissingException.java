package com.example.diversifier.provisioning;

/**
 * Thrown by a preferred factory when an optional library or feature it needs is absent.
 * The registry answers it by building the baseline variant instead.
 */
public class OptionalCapabilityMissingException extends RuntimeException {

    public OptionalCapabilityMissingException(String capability) {
        super("Optional capability not available: " + capability);
    }
}
