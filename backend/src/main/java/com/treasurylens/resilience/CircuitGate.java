package com.treasurylens.resilience;

import com.treasurylens.common.MissingEndpointException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Circuit breaker around one outbound dependency (the indexer, or chain RPC).
 * <p>
 * Closed: calls pass through. After {@code failureThreshold} consecutive failures the gate opens and every call
 * returns {@link GateResult.CircuitOpen} with the remaining cooldown, without touching the network. Once the
 * cooldown elapses exactly one trial call is let through (half-open). A successful trial closes the gate; a failed
 * one reopens it with the cooldown multiplied by the backoff factor, up to the configured cap.
 * <p>
 * The call whose failure trips the gate is itself reported as circuit-open. Failures and short-circuits are
 * forwarded to the {@link DebugSink}. State is in-memory per instance.
 */
@Slf4j
public class CircuitGate {

    static final Duration MAX_HALF_OPEN_HINT = Duration.ofSeconds(1);

    private final String name;
    private final CircuitBreaker breaker;
    private final Duration halfOpenHint;
    private final DebugSink debugSink;
    private final AtomicLong openUntilMillis = new AtomicLong(0L);

    public CircuitGate(String name, GateSettings settings, DebugSink debugSink) {
        this.name = name;
        this.debugSink = debugSink != null ? debugSink : DebugSink.NOOP;
        this.halfOpenHint = settings.cooldown().compareTo(MAX_HALF_OPEN_HINT) < 0 ? settings.cooldown() : MAX_HALF_OPEN_HINT;
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(
                settings.cooldown().toMillis(), settings.backoffMultiplier(), settings.maxCooldown().toMillis());
        IntervalFunction recordingBackoff = attempt -> {
            long waitMillis = backoff.apply(attempt);
            openUntilMillis.set(System.currentTimeMillis() + waitMillis);
            return waitMillis;
        };
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.failureThreshold())
                .minimumNumberOfCalls(settings.failureThreshold())
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitIntervalFunctionInOpenState(recordingBackoff)
                .ignoreExceptions(MissingEndpointException.class)
                .build();
        this.breaker = CircuitBreaker.of(name, config);
        this.breaker.getEventPublisher()
                .onStateTransition(event -> log.info("Circuit '{}' {}", name, event.getStateTransition()));
    }

    public <T> Mono<GateResult<T>> call(Supplier<Mono<T>> fn) {
        return call(name, Map.of(), fn);
    }

    /**
     * Runs {@code fn} through the gate. callId and variables identify the call in debug records.
     */
    public <T> Mono<GateResult<T>> call(String callId, Map<String, Object> variables, Supplier<Mono<T>> fn) {
        return Mono.defer(() -> {
            if (!breaker.tryAcquirePermission()) {
                Duration retryAfter = retryAfter();
                emit(callId, variables, "circuit open", "retry after " + retryAfter.toMillis() + " ms");
                return Mono.just(GateResult.<T>circuitOpen(name, retryAfter));
            }
            long startNanos = System.nanoTime();
            Mono<T> source;
            try {
                source = fn.get();
            } catch (RuntimeException e) {
                source = Mono.error(e);
            }
            return source
                    .map(data -> {
                        breaker.onSuccess(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
                        return GateResult.success(data);
                    })
                    .switchIfEmpty(Mono.fromSupplier(() -> {
                        breaker.onSuccess(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
                        return GateResult.<T>success(null);
                    }))
                    .onErrorResume(e -> {
                        breaker.onError(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS, e);
                        emit(callId, variables, messageOf(e), e.getClass().getName());
                        if (breaker.getState() == CircuitBreaker.State.OPEN) {
                            log.warn("Circuit '{}' opened by {}: {}", name, callId, messageOf(e));
                            return Mono.just(GateResult.<T>circuitOpen(name, retryAfter()));
                        }
                        return Mono.just(GateResult.<T>failure(e));
                    })
                    .doOnCancel(breaker::releasePermission);
        });
    }

    /**
     * Remaining cooldown while open; a short hint while a half-open trial is in flight; zero when closed.
     */
    public Duration retryAfter() {
        CircuitBreaker.State state = breaker.getState();
        if (state == CircuitBreaker.State.HALF_OPEN) {
            return halfOpenHint;
        }
        if (state != CircuitBreaker.State.OPEN) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(Math.max(0L, openUntilMillis.get() - System.currentTimeMillis()));
    }

    public CircuitBreaker.State state() {
        return breaker.getState();
    }

    public GateStats stats() {
        CircuitBreaker.Metrics metrics = breaker.getMetrics();
        return new GateStats(name, breaker.getState().name(), metrics.getNumberOfFailedCalls(),
                metrics.getNumberOfBufferedCalls(), retryAfter());
    }

    public void reset() {
        breaker.reset();
        openUntilMillis.set(0L);
    }

    public String getName() {
        return name;
    }

    private void emit(String callId, Map<String, Object> variables, String error, String details) {
        try {
            debugSink.record(new DebugRecord(name, callId, variables, error, details, Instant.now()));
        } catch (RuntimeException e) {
            log.warn("Debug sink rejected record from '{}': {}", name, e.getMessage());
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
