package com.treasurylens.api.controller;

import com.treasurylens.aggregation.SuckerGroupAggregator;
import com.treasurylens.domain.Chain;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * GET /api/v1/projects/{chainId}/{projectId}/snapshot.
 */
@RestController
@RequestMapping("/api/v1/projects")
@RequiredArgsConstructor
public class ProjectController {

    private final SuckerGroupAggregator aggregator;

    @GetMapping("/{chainId}/{projectId}/snapshot")
    public Mono<ResponseEntity<?>> snapshot(@PathVariable long chainId, @PathVariable long projectId,
                                            @RequestParam(defaultValue = "5") int version) {
        Chain chain = Chain.require(chainId);
        return aggregator.snapshot(projectId, chain, version)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .switchIfEmpty(RulesetController.notFound("Project " + projectId + " not found on chain " + chainId));
    }
}
