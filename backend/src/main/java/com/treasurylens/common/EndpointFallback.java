package com.treasurylens.common;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Tries each endpoint of a {@link RetryPolicy} sequentially until one succeeds.
 * Each attempt is bounded by the policy's per-attempt timeout; every failure is logged.
 * An attempt that completes empty counts as a miss. Exhausting the list fails with {@link UpstreamException}
 * carrying the last failure as cause.
 */
@Slf4j
public final class EndpointFallback {

    private EndpointFallback() {
    }

    public static <T> Mono<T> firstSuccess(RetryPolicy policy, String label, Function<String, Mono<T>> attempt) {
        return Mono.defer(() -> {
            List<String> order = policy.attemptOrder();
            AtomicReference<Throwable> lastFailure = new AtomicReference<>();
            return Flux.fromIterable(order)
                    .concatMap(endpoint -> Mono.defer(() -> attempt.apply(endpoint))
                            .timeout(policy.getPerAttemptTimeout())
                            .onErrorResume(e -> {
                                lastFailure.set(e);
                                log.warn("{} failed on {}: {}", label, endpoint, describe(e));
                                return Mono.empty();
                            }))
                    .next()
                    .switchIfEmpty(Mono.error(() -> new UpstreamException(
                            label + " failed on all " + order.size() + " attempt(s)", lastFailure.get())));
        });
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }
}
