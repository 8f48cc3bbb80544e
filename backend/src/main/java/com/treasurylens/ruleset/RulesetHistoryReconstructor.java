package com.treasurylens.ruleset;

import com.treasurylens.domain.CycleStatus;
import com.treasurylens.domain.Ruleset;
import com.treasurylens.domain.RulesetCycle;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.LongFunction;

/**
 * Rebuilds a project's per-cycle ruleset timeline from the current ruleset.
 * <p>
 * The rulesets contract stores only queued configurations; intermediate cycles are derived. Starting from the
 * stored copy of the current ruleset, basedOnId links are followed backward (bounded by {@link #MAX_HOPS}) to
 * collect every configuration ever applied. Each cycle from 1 to the current cycle number is then attributed to
 * the latest configuration that started at or before it, with start advanced by whole durations and weight
 * decayed once per elapsed cycle: {@code w = w * (1e9 - cut) / 1e9}, truncated each step as on-chain.
 * <p>
 * A configuration with duration 0 never advances by time and yields only the cycle it started in.
 */
@Slf4j
public class RulesetHistoryReconstructor {

    public static final int MAX_HOPS = 50;

    private static final BigInteger CUT_DENOMINATOR = BigInteger.valueOf(Ruleset.MAX_WEIGHT_CUT_PERCENT);

    /**
     * @param current    ruleset as returned by currentOf (cycle number of the active cycle)
     * @param lookup     stored ruleset by id; empty when unknown
     * @param maxHistory number of most recent cycles to keep
     * @return cycles newest first; the first element is the current cycle
     */
    public Mono<List<RulesetCycle>> reconstruct(Ruleset current, LongFunction<Mono<Ruleset>> lookup, int maxHistory) {
        if (current == null || !current.exists() || maxHistory <= 0) {
            return Mono.just(List.of());
        }
        return collectBases(current, lookup)
                .map(bases -> expand(bases, current.cycleNumber(), maxHistory));
    }

    /**
     * Distinct stored configurations reachable from the current ruleset, oldest first.
     */
    Mono<List<Ruleset>> collectBases(Ruleset current, LongFunction<Mono<Ruleset>> lookup) {
        return Mono.defer(() -> {
            Set<Long> seen = new HashSet<>();
            Mono<Ruleset> head = lookup.apply(current.id())
                    .filter(Ruleset::exists)
                    .onErrorResume(e -> {
                        log.warn("Stored copy of ruleset {} unavailable, using the current read: {}", current.id(), e.getMessage());
                        return Mono.empty();
                    })
                    .defaultIfEmpty(current);
            return head.expand(r -> {
                        seen.add(r.id());
                        long next = r.basedOnId();
                        if (next == 0L || seen.contains(next)) {
                            return Mono.empty();
                        }
                        return lookup.apply(next)
                                .filter(Ruleset::exists)
                                .onErrorResume(e -> {
                                    log.warn("Ruleset {} lookup failed, history truncated: {}", next, e.getMessage());
                                    return Mono.empty();
                                });
                    })
                    .take(MAX_HOPS + 1L)
                    .collectList()
                    .map(list -> {
                        List<Ruleset> bases = new ArrayList<>(list);
                        bases.sort(Comparator.comparingLong(Ruleset::cycleNumber));
                        return bases;
                    });
        });
    }

    List<RulesetCycle> expand(List<Ruleset> basesAscending, long currentCycle, int maxHistory) {
        List<RulesetCycle> cycles = new ArrayList<>();
        Ruleset activeBase = null;
        BigInteger weight = BigInteger.ZERO;
        int nextBase = 0;
        for (long cycle = 1; cycle <= currentCycle; cycle++) {
            while (nextBase < basesAscending.size() && basesAscending.get(nextBase).cycleNumber() <= cycle) {
                activeBase = basesAscending.get(nextBase++);
                weight = activeBase.weight();
            }
            if (activeBase == null) {
                continue;
            }
            long cyclesAfterBase = cycle - activeBase.cycleNumber();
            if (cyclesAfterBase > 0 && activeBase.duration() == 0L) {
                continue;
            }
            if (cyclesAfterBase > 0) {
                weight = decay(weight, activeBase.weightCutPercent());
            }
            long start = cyclesAfterBase == 0
                    ? activeBase.start()
                    : activeBase.start() + cyclesAfterBase * activeBase.duration();
            cycles.add(new RulesetCycle(
                    cycle,
                    activeBase.id(),
                    start,
                    activeBase.duration(),
                    weight,
                    activeBase.weightCutPercent(),
                    activeBase.metadata(),
                    cycle == currentCycle ? CycleStatus.CURRENT : CycleStatus.PAST));
        }
        int from = Math.max(0, cycles.size() - maxHistory);
        List<RulesetCycle> recent = new ArrayList<>(cycles.subList(from, cycles.size()));
        Collections.reverse(recent);
        return recent;
    }

    static BigInteger decay(BigInteger weight, long weightCutPercent) {
        if (weightCutPercent <= 0L) {
            return weight;
        }
        return weight.multiply(CUT_DENOMINATOR.subtract(BigInteger.valueOf(weightCutPercent))).divide(CUT_DENOMINATOR);
    }

    /**
     * Effective weight n cycles after a base: weight * (1 - cut/1e9)^n with per-cycle truncation.
     */
    public static BigInteger weightAfter(BigInteger baseWeight, long weightCutPercent, long cycles) {
        BigInteger w = baseWeight;
        for (long i = 0; i < cycles; i++) {
            w = decay(w, weightCutPercent);
        }
        return w;
    }
}
