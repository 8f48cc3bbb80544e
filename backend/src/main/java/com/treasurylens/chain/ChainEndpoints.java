package com.treasurylens.chain;

import com.treasurylens.common.MissingEndpointException;
import com.treasurylens.common.RetryPolicy;
import com.treasurylens.domain.Chain;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-chain RPC endpoint lists, in fallback order, and the retry policy built from them.
 */
public class ChainEndpoints {

    private final Map<Long, List<String>> endpointsByChain;
    private final Duration perAttemptTimeout;
    private final int maxAttempts;

    /**
     * @param maxAttempts attempts per call; 0 or less means one attempt per configured endpoint
     */
    public ChainEndpoints(Map<Long, List<String>> endpointsByChain, Duration perAttemptTimeout, int maxAttempts) {
        Map<Long, List<String>> copy = new HashMap<>();
        if (endpointsByChain != null) {
            endpointsByChain.forEach((chainId, urls) -> {
                if (urls != null && !urls.isEmpty()) {
                    copy.put(chainId, List.copyOf(urls));
                }
            });
        }
        this.endpointsByChain = Map.copyOf(copy);
        this.perAttemptTimeout = perAttemptTimeout;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @throws MissingEndpointException if no endpoint is configured for the chain
     */
    public RetryPolicy policyFor(Chain chain) {
        List<String> urls = endpointsByChain.get(chain.getId());
        if (urls == null) {
            throw new MissingEndpointException(chain.getId());
        }
        return new RetryPolicy(urls, perAttemptTimeout, maxAttempts > 0 ? maxAttempts : urls.size());
    }

    public boolean isConfigured(Chain chain) {
        return endpointsByChain.containsKey(chain.getId());
    }
}
