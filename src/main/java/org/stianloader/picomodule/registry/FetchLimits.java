package org.stianloader.picomodule.registry;

import org.jetbrains.annotations.NotNull;

/**
 * Deadline and size ceiling of a single remote fetch.
 *
 * @param timeoutMillis The overall deadline in milliseconds, covering connect, headers and body
 * @param maxBytes The maximum amount of body bytes
 */
public final record FetchLimits(long timeoutMillis, long maxBytes) {

    /**
     * Limits used when fetching a registry index for installation: 10 seconds, 1 MiB.
     */
    @NotNull
    public static final FetchLimits REGISTRY_INDEX = new FetchLimits(10_000L, 1L << 20);

    /**
     * Limits used when fetching a registry index for release verification: 15 seconds, 2 MiB.
     */
    @NotNull
    public static final FetchLimits VERIFIER_INDEX = new FetchLimits(15_000L, 2L << 20);

    public FetchLimits {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be positive, got " + timeoutMillis);
        }
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive, got " + maxBytes);
        }
    }
}
