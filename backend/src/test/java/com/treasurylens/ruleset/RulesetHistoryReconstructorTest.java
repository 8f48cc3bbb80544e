package com.treasurylens.ruleset;

import com.treasurylens.domain.CycleStatus;
import com.treasurylens.domain.Ruleset;
import com.treasurylens.domain.RulesetCycle;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongFunction;

import static org.assertj.core.api.Assertions.assertThat;

class RulesetHistoryReconstructorTest {

    private final RulesetHistoryReconstructor reconstructor = new RulesetHistoryReconstructor();
    private final Map<Long, Ruleset> stored = new HashMap<>();
    private final LongFunction<Mono<Ruleset>> lookup = id -> Mono.justOrEmpty(stored.get(id));

    @Test
    void zeroCut_keepsWeightConstantAndAdvancesStart() {
        store(ruleset(1, 100, 0, 1_000, 100, 1_000, 0));

        List<RulesetCycle> cycles = reconstructor.reconstruct(current(3, 100), lookup, 20).block();

        assertThat(cycles).extracting(RulesetCycle::cycleNumber).containsExactly(3L, 2L, 1L);
        assertThat(cycles).extracting(RulesetCycle::start).containsExactly(1_200L, 1_100L, 1_000L);
        assertThat(cycles).extracting(RulesetCycle::weight).allMatch(w -> w.equals(BigInteger.valueOf(1_000)));
        assertThat(cycles.get(0).status()).isEqualTo(CycleStatus.CURRENT);
        assertThat(cycles.get(1).status()).isEqualTo(CycleStatus.PAST);
    }

    @Test
    void weightCut_decaysOncePerElapsedCycle() {
        store(ruleset(1, 100, 0, 0, 86_400, 1_000, 100_000_000));

        List<RulesetCycle> cycles = reconstructor.reconstruct(current(3, 100), lookup, 20).block();

        assertThat(cycles).extracting(RulesetCycle::weight)
                .containsExactly(BigInteger.valueOf(810), BigInteger.valueOf(900), BigInteger.valueOf(1_000));
    }

    @Test
    void queuedConfigurations_takeOverFromTheirCycle() {
        store(ruleset(1, 10, 0, 0, 100, 1_000, 0));
        store(ruleset(3, 20, 10, 500, 50, 2_000, 0));

        List<RulesetCycle> cycles = reconstructor.reconstruct(current(4, 20), lookup, 20).block();

        assertThat(cycles).extracting(RulesetCycle::rulesetId).containsExactly(20L, 20L, 10L, 10L);
        assertThat(cycles).extracting(RulesetCycle::start).containsExactly(550L, 500L, 100L, 0L);
        assertThat(cycles.get(1).weight()).isEqualTo(BigInteger.valueOf(2_000));
    }

    @Test
    void cyclesBeforeFirstKnownBase_areSkipped() {
        store(ruleset(3, 30, 0, 900, 100, 1_000, 0));

        List<RulesetCycle> cycles = reconstructor.reconstruct(current(4, 30), lookup, 20).block();

        assertThat(cycles).extracting(RulesetCycle::cycleNumber).containsExactly(4L, 3L);
    }

    @Test
    void zeroDuration_yieldsOnlyTheStartingCycle() {
        store(ruleset(1, 100, 0, 1_000, 0, 1_000, 0));

        List<RulesetCycle> cycles = reconstructor.reconstruct(current(3, 100), lookup, 20).block();

        assertThat(cycles).hasSize(1);
        assertThat(cycles.get(0).cycleNumber()).isEqualTo(1L);
    }

    @Test
    void maxHistory_keepsMostRecentCycles() {
        store(ruleset(1, 100, 0, 0, 10, 1_000, 0));

        List<RulesetCycle> cycles = reconstructor.reconstruct(current(5, 100), lookup, 2).block();

        assertThat(cycles).extracting(RulesetCycle::cycleNumber).containsExactly(5L, 4L);
    }

    @Test
    void basedOnCycle_terminates() {
        store(ruleset(1, 10, 20, 0, 100, 1_000, 0));
        store(ruleset(2, 20, 10, 100, 100, 1_000, 0));

        List<RulesetCycle> cycles = reconstructor.reconstruct(current(2, 20), lookup, 20).block();

        assertThat(cycles).extracting(RulesetCycle::rulesetId).containsExactly(20L, 10L);
    }

    @Test
    void failedBaseLookup_truncatesHistory() {
        store(ruleset(3, 20, 10, 500, 50, 2_000, 0));
        LongFunction<Mono<Ruleset>> flaky = id -> id == 10L
                ? Mono.error(new IllegalStateException("rpc down"))
                : lookup.apply(id);

        List<RulesetCycle> cycles = reconstructor.reconstruct(current(4, 20), flaky, 20).block();

        assertThat(cycles).extracting(RulesetCycle::cycleNumber).containsExactly(4L, 3L);
    }

    @Test
    void failedCurrentLookup_fallsBackToCurrentRead() {
        Ruleset live = ruleset(1, 10, 0, 100, 50, 500, 0);
        LongFunction<Mono<Ruleset>> down = id -> Mono.error(new IllegalStateException("rpc down"));

        List<RulesetCycle> cycles = reconstructor.reconstruct(live, down, 20).block();

        assertThat(cycles).singleElement().satisfies(c -> {
            assertThat(c.rulesetId()).isEqualTo(10L);
            assertThat(c.start()).isEqualTo(100L);
            assertThat(c.weight()).isEqualTo(BigInteger.valueOf(500));
            assertThat(c.status()).isEqualTo(CycleStatus.CURRENT);
        });
    }

    @Test
    void missingCurrent_yieldsEmptyHistory() {
        Ruleset none = new Ruleset(0, 0, 0, 0, 0, BigInteger.ZERO, 0, null, BigInteger.ZERO);
        assertThat(reconstructor.reconstruct(none, lookup, 20).block()).isEmpty();
    }

    @Test
    void weightAfter_matchesRepeatedDecay() {
        assertThat(RulesetHistoryReconstructor.weightAfter(BigInteger.valueOf(1_000), 100_000_000, 2))
                .isEqualTo(BigInteger.valueOf(810));
        assertThat(RulesetHistoryReconstructor.weightAfter(BigInteger.valueOf(1_000), 0, 50))
                .isEqualTo(BigInteger.valueOf(1_000));
    }

    private void store(Ruleset ruleset) {
        stored.put(ruleset.id(), ruleset);
    }

    private static Ruleset current(long cycleNumber, long id) {
        return new Ruleset(cycleNumber, id, 0, 0, 0, BigInteger.ONE, 0, null, BigInteger.ZERO);
    }

    private static Ruleset ruleset(long cycleNumber, long id, long basedOnId, long start, long duration,
                                   long weight, long cut) {
        return new Ruleset(cycleNumber, id, basedOnId, start, duration, BigInteger.valueOf(weight), cut,
                "0x0000000000000000000000000000000000000000", BigInteger.ZERO);
    }
}
