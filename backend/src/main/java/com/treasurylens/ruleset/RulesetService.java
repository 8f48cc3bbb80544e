package com.treasurylens.ruleset;

import com.treasurylens.cache.TreasuryCache;
import com.treasurylens.cache.TreasuryCaches;
import com.treasurylens.chain.ContractResolver;
import com.treasurylens.chain.ProtocolReader;
import com.treasurylens.domain.Chain;
import com.treasurylens.domain.FundAccessLimits;
import com.treasurylens.domain.QueuedRuleset;
import com.treasurylens.domain.Ruleset;
import com.treasurylens.domain.RulesetCycle;
import com.treasurylens.domain.SplitGroups;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Cached ruleset reads for one project on one chain. Rulesets that do not exist (id 0) are empty and never cached.
 * Every miss resolves the project's contract bundle first, so reads follow the controller the directory names.
 */
@Slf4j
@RequiredArgsConstructor
public class RulesetService {

    public static final int DEFAULT_MAX_HISTORY = 20;

    private final ContractResolver resolver;
    private final ProtocolReader reader;
    private final TreasuryCaches caches;
    private final RulesetHistoryReconstructor reconstructor;

    public Mono<Ruleset> current(Chain chain, long projectId) {
        return caches.currentRulesets().getOrLoad(TreasuryCaches.key(chain.getId(), projectId),
                () -> readCurrent(chain, projectId));
    }

    public Mono<QueuedRuleset> queued(Chain chain, long projectId) {
        return caches.queuedRulesets().getOrLoad(TreasuryCaches.key(chain.getId(), projectId),
                () -> resolver.resolve(projectId, chain)
                        .flatMap(bundle -> reader.latestQueuedOf(chain, projectId, bundle)));
    }

    /**
     * Payout and reserved splits of a ruleset, read concurrently.
     */
    public Mono<SplitGroups> splits(Chain chain, long projectId, long rulesetId) {
        return caches.splits().getOrLoad(TreasuryCaches.key(chain.getId(), projectId, rulesetId),
                () -> Mono.zip(reader.payoutSplits(chain, projectId, rulesetId),
                                reader.reservedSplits(chain, projectId, rulesetId))
                        .map(t -> new SplitGroups(t.getT1(), t.getT2())));
    }

    /**
     * Payout limits and surplus allowances for the project's terminal and the given accounting token.
     */
    public Mono<FundAccessLimits> fundAccessLimits(Chain chain, long projectId, long rulesetId, String token) {
        String key = TreasuryCaches.key(chain.getId(), projectId, rulesetId) + ":" + token;
        return caches.fundAccessLimits().getOrLoad(key,
                () -> resolver.resolve(projectId, chain)
                        .flatMap(bundle -> reader.fundAccessLimits(chain, projectId, rulesetId, bundle.terminal(), token)));
    }

    /**
     * Most recent cycles, newest first. Keyed by the current cycle number: a past timeline never changes.
     */
    public Mono<List<RulesetCycle>> history(Chain chain, long projectId, int maxHistory) {
        return current(chain, projectId).flatMap(current -> {
            String key = TreasuryCaches.key(chain.getId(), projectId, current.cycleNumber()) + ":" + maxHistory;
            return caches.history().getOrLoad(key,
                    () -> resolver.resolve(projectId, chain)
                            .flatMap(bundle -> reconstructor.reconstruct(current,
                                    rulesetId -> reader.getRulesetOf(chain, projectId, rulesetId, bundle), maxHistory)));
        });
    }

    /**
     * Cycle number of the active ruleset, read on-chain without the cache.
     */
    public Mono<Long> currentCycleNumber(Chain chain, long projectId) {
        return readCurrent(chain, projectId).map(Ruleset::cycleNumber);
    }

    /**
     * Reads the live cycle number and, when it differs from the last one seen, drops the project's current,
     * queued and split entries. Emits true when entries were dropped.
     */
    public Mono<Boolean> refreshIfCycleChanged(Chain chain, long projectId) {
        String key = TreasuryCaches.key(chain.getId(), projectId);
        return currentCycleNumber(chain, projectId)
                .map(cycle -> {
                    TreasuryCache<String, Long> seen = caches.cycleNumbers();
                    Long previous = seen.get(key).orElse(null);
                    seen.set(key, cycle);
                    if (previous == null || previous.longValue() == cycle.longValue()) {
                        return false;
                    }
                    log.info("Project {} on chain {} moved from cycle {} to {}, dropping cached rulesets",
                            projectId, chain.getId(), previous, cycle);
                    invalidateProject(chain, projectId);
                    return true;
                })
                .defaultIfEmpty(false);
    }

    public void invalidateProject(Chain chain, long projectId) {
        String key = TreasuryCaches.key(chain.getId(), projectId);
        caches.currentRulesets().invalidate(key);
        caches.queuedRulesets().invalidate(key);
        caches.splits().invalidateIf(k -> k.startsWith(key + ":"));
    }

    private Mono<Ruleset> readCurrent(Chain chain, long projectId) {
        return resolver.resolve(projectId, chain).flatMap(bundle -> reader.currentOf(chain, projectId, bundle));
    }
}
