package com.treasurylens.api.controller;

import com.treasurylens.api.dto.CycleResponse;
import com.treasurylens.api.dto.ErrorBody;
import com.treasurylens.api.dto.HistoryResponse;
import com.treasurylens.api.dto.RulesetResponse;
import com.treasurylens.api.dto.SplitsResponse;
import com.treasurylens.api.dto.StatsResponse;
import com.treasurylens.cache.TreasuryCaches;
import com.treasurylens.config.GateConfig;
import com.treasurylens.domain.Chain;
import com.treasurylens.domain.SplitGroups;
import com.treasurylens.resilience.CircuitGate;
import com.treasurylens.ruleset.RulesetMetadataCodec;
import com.treasurylens.ruleset.RulesetService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * GET /api/v1/rulesets/{chainId}/{projectId}/current|queued|history|cycle, .../{rulesetId}/splits, /stats.
 */
@RestController
@RequestMapping("/api/v1/rulesets")
public class RulesetController {

    static final int MAX_HISTORY_LIMIT = 500;

    private final RulesetService rulesetService;
    private final TreasuryCaches treasuryCaches;
    private final CircuitGate indexerGate;
    private final CircuitGate rpcGate;

    public RulesetController(RulesetService rulesetService, TreasuryCaches treasuryCaches,
                             @Qualifier(GateConfig.INDEXER_GATE) CircuitGate indexerGate,
                             @Qualifier(GateConfig.RPC_GATE) CircuitGate rpcGate) {
        this.rulesetService = rulesetService;
        this.treasuryCaches = treasuryCaches;
        this.indexerGate = indexerGate;
        this.rpcGate = rpcGate;
    }

    @GetMapping("/{chainId}/{projectId}/current")
    public Mono<ResponseEntity<?>> current(@PathVariable long chainId, @PathVariable long projectId) {
        Chain chain = Chain.require(chainId);
        return rulesetService.current(chain, projectId)
                .<ResponseEntity<?>>map(r -> ResponseEntity.ok(new RulesetResponse(chainId, projectId, r,
                        RulesetMetadataCodec.decode(r.metadata()), null)))
                .switchIfEmpty(notFound("No ruleset for project " + projectId + " on chain " + chainId));
    }

    @GetMapping("/{chainId}/{projectId}/queued")
    public Mono<ResponseEntity<?>> queued(@PathVariable long chainId, @PathVariable long projectId) {
        Chain chain = Chain.require(chainId);
        return rulesetService.queued(chain, projectId)
                .<ResponseEntity<?>>map(q -> ResponseEntity.ok(new RulesetResponse(chainId, projectId, q.ruleset(),
                        RulesetMetadataCodec.decode(q.ruleset().metadata()), q.approvalStatus())))
                .switchIfEmpty(notFound("No queued ruleset for project " + projectId + " on chain " + chainId));
    }

    @GetMapping("/{chainId}/{projectId}/history")
    public Mono<ResponseEntity<?>> history(@PathVariable long chainId, @PathVariable long projectId,
                                           @RequestParam(defaultValue = "" + RulesetService.DEFAULT_MAX_HISTORY) int limit) {
        Chain chain = Chain.require(chainId);
        if (limit <= 0 || limit > MAX_HISTORY_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        return rulesetService.history(chain, projectId, limit)
                .<ResponseEntity<?>>map(cycles -> ResponseEntity.ok(new HistoryResponse(chainId, projectId, cycles)))
                .switchIfEmpty(notFound("No ruleset for project " + projectId + " on chain " + chainId));
    }

    @GetMapping("/{chainId}/{projectId}/cycle")
    public Mono<ResponseEntity<?>> cycle(@PathVariable long chainId, @PathVariable long projectId) {
        Chain chain = Chain.require(chainId);
        return rulesetService.currentCycleNumber(chain, projectId)
                .<ResponseEntity<?>>map(n -> ResponseEntity.ok(new CycleResponse(chainId, projectId, n)))
                .switchIfEmpty(notFound("No ruleset for project " + projectId + " on chain " + chainId));
    }

    @GetMapping("/{chainId}/{projectId}/{rulesetId}/splits")
    public Mono<ResponseEntity<?>> splits(@PathVariable long chainId, @PathVariable long projectId,
                                          @PathVariable long rulesetId) {
        Chain chain = Chain.require(chainId);
        return rulesetService.splits(chain, projectId, rulesetId)
                .<ResponseEntity<?>>map(groups -> ResponseEntity.ok(new SplitsResponse(chainId, projectId, rulesetId,
                        groups.payoutSplits(), SplitGroups.ownerRemainder(groups.payoutSplits()),
                        groups.reservedSplits(), SplitGroups.ownerRemainder(groups.reservedSplits()))))
                .switchIfEmpty(notFound("No splits for ruleset " + rulesetId));
    }

    @GetMapping("/stats")
    public StatsResponse stats() {
        return new StatsResponse(treasuryCaches.stats(), List.of(indexerGate.stats(), rpcGate.stats()));
    }

    static Mono<ResponseEntity<?>> notFound(String message) {
        return Mono.fromSupplier(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("NOT_FOUND", message)));
    }
}
