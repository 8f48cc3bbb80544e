package com.treasurylens.api.controller;

import com.treasurylens.api.dto.ErrorBody;
import com.treasurylens.common.CircuitOpenException;
import com.treasurylens.common.ErrorKind;
import com.treasurylens.common.MetadataDecodeException;
import com.treasurylens.common.MissingEndpointException;
import com.treasurylens.common.TreasuryDataException;
import com.treasurylens.common.UpstreamException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TreasuryExceptionHandlerTest {

    private final TreasuryExceptionHandler handler = new TreasuryExceptionHandler();

    @Test
    void circuitOpen_is503WithRetryAfterRoundedUp() {
        ResponseEntity<ErrorBody> response = handler.handleDataException(
                new CircuitOpenException("indexer", Duration.ofMillis(29_100)));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("30");
        assertThat(response.getBody().error()).isEqualTo("CIRCUIT_OPEN");
    }

    @Test
    void circuitOpen_retryAfterIsAtLeastOneSecond() {
        ResponseEntity<ErrorBody> response = handler.handleDataException(new CircuitOpenException("rpc", Duration.ZERO));

        assertThat(response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("1");
    }

    @Test
    void upstream_is502() {
        assertThat(handler.handleDataException(new UpstreamException("down")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    void decode_is422() {
        ResponseEntity<ErrorBody> response = handler.handleDataException(new MetadataDecodeException("bad word"));
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().error()).isEqualTo("DECODE_ERROR");
    }

    @Test
    void missingEndpoint_is500ConfigError() {
        ResponseEntity<ErrorBody> response = handler.handleDataException(new MissingEndpointException(8453L));
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().error()).isEqualTo("CONFIG_ERROR");
        assertThat(response.getBody().message()).contains("8453");
    }

    @Test
    void notFound_is404() {
        assertThat(handler.handleDataException(new TreasuryDataException(ErrorKind.NOT_FOUND, "gone")).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void illegalArgument_is400() {
        ResponseEntity<ErrorBody> response = handler.handleBadRequest(new IllegalArgumentException("Unsupported chain: 5"));
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().error()).isEqualTo("INVALID_REQUEST");
    }
}
