package com.openforge.chronicle.memory.index;

/**
 * Lifecycle of a semantic index backend.
 *
 * UNKNOWN → AVAILABLE on the first successful call, UNKNOWN/AVAILABLE → UNAVAILABLE
 * on the first backend failure. UNAVAILABLE is sticky for the lifetime of the instance.
 */
public enum IndexAvailability {
    UNKNOWN,
    AVAILABLE,
    UNAVAILABLE
}
