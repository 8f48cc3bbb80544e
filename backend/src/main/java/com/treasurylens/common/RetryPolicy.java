package com.treasurylens.common;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered endpoint list, per-attempt timeout and attempt cap for {@link EndpointFallback}.
 * Attempts walk the endpoints in order; when maxAttempts exceeds the list size the walk wraps around.
 */
public final class RetryPolicy {

    /** Per-attempt bound used when none is configured. */
    public static final Duration DEFAULT_PER_ATTEMPT_TIMEOUT = Duration.ofSeconds(15);

    private final List<String> endpoints;
    private final Duration perAttemptTimeout;
    private final int maxAttempts;

    public RetryPolicy(List<String> endpoints, Duration perAttemptTimeout, int maxAttempts) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got: " + maxAttempts);
        }
        this.endpoints = List.copyOf(endpoints);
        this.perAttemptTimeout = perAttemptTimeout != null && !perAttemptTimeout.isNegative() && !perAttemptTimeout.isZero()
                ? perAttemptTimeout
                : DEFAULT_PER_ATTEMPT_TIMEOUT;
        this.maxAttempts = maxAttempts;
    }

    /**
     * One attempt per endpoint, default timeout.
     */
    public static RetryPolicy of(List<String> endpoints) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint required");
        }
        return new RetryPolicy(endpoints, DEFAULT_PER_ATTEMPT_TIMEOUT, endpoints.size());
    }

    /**
     * Endpoint to use for each attempt, in order. Size equals maxAttempts.
     */
    public List<String> attemptOrder() {
        List<String> order = new ArrayList<>(maxAttempts);
        for (int i = 0; i < maxAttempts; i++) {
            order.add(endpoints.get(i % endpoints.size()));
        }
        return order;
    }

    public List<String> getEndpoints() {
        return endpoints;
    }

    public Duration getPerAttemptTimeout() {
        return perAttemptTimeout;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public String toString() {
        return "RetryPolicy{endpoints=" + endpoints.size() + ", perAttemptTimeout=" + perAttemptTimeout
                + ", maxAttempts=" + maxAttempts + "}";
    }
}
