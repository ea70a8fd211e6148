package com.routermon.models;

/**
 * Outcome of one refresh cycle for one device.

 * State Machine:
 * NOT_PROCESSED → SKIPPED_BUSY (a cycle for the device is already in flight)
 *               → NOT_FOUND (device record missing)
 *               → SKIPPED_MAINTENANCE (device held for maintenance)
 *               → CONNECTIVITY_FAILED (session open or a command lost the device)
 *               → FAILED (cycle could not start, e.g. undecryptable secret)
 *               → PARTIAL (device reached, one or more features failed)
 *               → SUCCESS (every requested feature completed)
 */
public enum RefreshOutcome
{

    NOT_PROCESSED,           // Initial state - not yet processed

    SKIPPED_BUSY,            // Overlapping request rejected

    NOT_FOUND,               // No such device

    SKIPPED_MAINTENANCE,     // Device in maintenance

    CONNECTIVITY_FAILED,     // Device marked offline

    FAILED,                  // Non-connectivity failure before the session opened

    PARTIAL,                 // Reached, with isolated feature errors

    SUCCESS                  // All requested features completed

}
