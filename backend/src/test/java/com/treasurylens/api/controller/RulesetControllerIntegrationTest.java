package com.treasurylens.api.controller;

import com.treasurylens.aggregation.SuckerGroupAggregator;
import com.treasurylens.common.CircuitOpenException;
import com.treasurylens.common.UpstreamException;
import com.treasurylens.domain.Chain;
import com.treasurylens.domain.CycleStatus;
import com.treasurylens.domain.Ruleset;
import com.treasurylens.domain.RulesetCycle;
import com.treasurylens.domain.Split;
import com.treasurylens.domain.SplitGroups;
import com.treasurylens.ruleset.RulesetService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
        "treasurylens.watch.poll-interval-ms=3600000",
        "treasurylens.indexer.url=http://localhost:9/graphql"
})
@AutoConfigureWebTestClient
class RulesetControllerIntegrationTest {

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    RulesetService rulesetService;
    @MockBean
    SuckerGroupAggregator aggregator;

    @Test
    @DisplayName("current ruleset is returned with its metadata decoded")
    void currentRuleset() {
        BigInteger metadata = BigInteger.valueOf(1_000).or(BigInteger.valueOf(6_000).shiftLeft(16));
        when(rulesetService.current(Chain.ETHEREUM, 3L)).thenReturn(Mono.just(
                new Ruleset(4, 40, 0, 1_700_000_000L, 604_800, BigInteger.TEN, 0, null, metadata)));

        webTestClient.get()
                .uri("/api/v1/rulesets/1/3/current")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.chainId").isEqualTo(1)
                .jsonPath("$.ruleset.cycleNumber").isEqualTo(4)
                .jsonPath("$.metadata.reservedPercent").isEqualTo(1000)
                .jsonPath("$.metadata.cashOutTaxRate").isEqualTo(6000);
    }

    @Test
    @DisplayName("missing ruleset is 404")
    void missingRuleset() {
        when(rulesetService.current(Chain.OPTIMISM, 99L)).thenReturn(Mono.empty());

        webTestClient.get()
                .uri("/api/v1/rulesets/10/99/current")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    @DisplayName("unsupported chain is 400")
    void unsupportedChain() {
        webTestClient.get()
                .uri("/api/v1/rulesets/56/3/current")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REQUEST");
    }

    @Test
    @DisplayName("open circuit is 503 with Retry-After")
    void openCircuit() {
        when(rulesetService.queued(Chain.BASE, 3L))
                .thenReturn(Mono.error(new CircuitOpenException("rpc", Duration.ofSeconds(42))));

        webTestClient.get()
                .uri("/api/v1/rulesets/8453/3/queued")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectHeader().valueEquals(HttpHeaders.RETRY_AFTER, "42")
                .expectBody()
                .jsonPath("$.error").isEqualTo("CIRCUIT_OPEN");
    }

    @Test
    @DisplayName("history honours the limit and rejects out-of-range values")
    void history() {
        when(rulesetService.history(eq(Chain.ETHEREUM), eq(3L), anyInt())).thenReturn(Mono.just(List.of(
                new RulesetCycle(2, 40, 100, 100, BigInteger.TEN, 0, BigInteger.ZERO, CycleStatus.CURRENT),
                new RulesetCycle(1, 40, 0, 100, BigInteger.TEN, 0, BigInteger.ZERO, CycleStatus.PAST))));

        webTestClient.get()
                .uri("/api/v1/rulesets/1/3/history?limit=2")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.cycles.length()").isEqualTo(2)
                .jsonPath("$.cycles[0].status").isEqualTo("CURRENT");

        webTestClient.get()
                .uri("/api/v1/rulesets/1/3/history?limit=0")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("splits include the owner remainder of each group")
    void splits() {
        Split payout = new Split(250_000_000L, 0, "0x00000000000000000000000000000000000000b1", false, 0, null);
        when(rulesetService.splits(Chain.ETHEREUM, 3L, 40L))
                .thenReturn(Mono.just(new SplitGroups(List.of(payout), List.of())));

        webTestClient.get()
                .uri("/api/v1/rulesets/1/3/40/splits")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.payoutOwnerRemainder").isEqualTo(750000000)
                .jsonPath("$.reservedOwnerRemainder").isEqualTo(1000000000);
    }

    @Test
    @DisplayName("stats list every cache and both gates")
    void stats() {
        webTestClient.get()
                .uri("/api/v1/rulesets/stats")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.caches.length()").isEqualTo(6)
                .jsonPath("$.gates.length()").isEqualTo(2)
                .jsonPath("$.gates[0].name").isEqualTo("indexer");
    }

    @Test
    @DisplayName("snapshot upstream failure is 502")
    void snapshotUpstreamFailure() {
        when(aggregator.snapshot(anyLong(), eq(Chain.ETHEREUM), anyInt()))
                .thenReturn(Mono.error(new UpstreamException("indexer down")));

        webTestClient.get()
                .uri("/api/v1/projects/1/3/snapshot")
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("UPSTREAM_ERROR");
    }

    @Test
    @DisplayName("debug failures endpoint returns the recent buffer")
    void debugFailures() {
        webTestClient.get()
                .uri("/api/v1/debug/failures")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$").isArray();
    }
}
