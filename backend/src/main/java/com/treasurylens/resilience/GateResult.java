package com.treasurylens.resilience;

import com.treasurylens.common.CircuitOpenException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Outcome of a {@link CircuitGate} call. Callers branch on {@link #status()}; a gate call never errors.
 * A successful call that produced no value is a {@link Success} with null data.
 */
public interface GateResult<T> {

    Status status();

    /**
     * Success(data) emits data (empty when null), Failure errors with the cause, CircuitOpen errors with
     * {@link CircuitOpenException}.
     */
    Mono<T> toMono();

    enum Status {
        SUCCESS,
        FAILURE,
        CIRCUIT_OPEN
    }

    static <T> GateResult<T> success(T data) {
        return new Success<>(data);
    }

    static <T> GateResult<T> failure(Throwable error) {
        return new Failure<>(error);
    }

    static <T> GateResult<T> circuitOpen(String gate, Duration retryAfter) {
        return new CircuitOpen<>(gate, retryAfter);
    }

    record Success<T>(T data) implements GateResult<T> {
        @Override
        public Status status() {
            return Status.SUCCESS;
        }

        @Override
        public Mono<T> toMono() {
            return Mono.justOrEmpty(data);
        }
    }

    record Failure<T>(Throwable error) implements GateResult<T> {
        @Override
        public Status status() {
            return Status.FAILURE;
        }

        @Override
        public Mono<T> toMono() {
            return Mono.error(error);
        }
    }

    record CircuitOpen<T>(String gate, Duration retryAfter) implements GateResult<T> {
        @Override
        public Status status() {
            return Status.CIRCUIT_OPEN;
        }

        @Override
        public Mono<T> toMono() {
            return Mono.error(new CircuitOpenException(gate, retryAfter));
        }
    }
}
