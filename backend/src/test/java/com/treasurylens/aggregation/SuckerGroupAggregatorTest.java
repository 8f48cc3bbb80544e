package com.treasurylens.aggregation;

import com.treasurylens.chain.ContractBundle;
import com.treasurylens.chain.ContractResolver;
import com.treasurylens.chain.JbContracts;
import com.treasurylens.chain.ProtocolReader;
import com.treasurylens.common.MissingEndpointException;
import com.treasurylens.common.UpstreamException;
import com.treasurylens.domain.Chain;
import com.treasurylens.domain.Currency;
import com.treasurylens.domain.CurrencyAmount;
import com.treasurylens.domain.FundAccessLimits;
import com.treasurylens.domain.Page;
import com.treasurylens.domain.Participant;
import com.treasurylens.domain.PayEvent;
import com.treasurylens.domain.Project;
import com.treasurylens.domain.Ruleset;
import com.treasurylens.domain.RulesetMetadata;
import com.treasurylens.domain.SuckerGroup;
import com.treasurylens.indexer.IndexedProject;
import com.treasurylens.indexer.IndexerClient;
import com.treasurylens.indexer.ParticipantPage;
import com.treasurylens.ruleset.RulesetMetadataCodec;
import com.treasurylens.ruleset.RulesetService;
import com.treasurylens.treasury.PayoutCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SuckerGroupAggregatorTest {

    private static final ContractBundle BUNDLE = JbContracts.v51Bundle();
    private static final String TERMINAL = BUNDLE.terminal();
    private static final String NATIVE = JbContracts.NATIVE_TOKEN;
    private static final String ALICE = "0xa11ce00000000000000000000000000000000001";
    private static final BigInteger WEIGHT = BigInteger.TEN.pow(18).multiply(BigInteger.valueOf(1_000));

    @Mock
    private ContractResolver resolver;
    @Mock
    private ProtocolReader reader;
    @Mock
    private RulesetService rulesets;
    @Mock
    private IndexerClient indexer;

    private SuckerGroupAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new SuckerGroupAggregator(resolver, reader, rulesets, indexer);
        when(resolver.resolve(anyLong(), any())).thenReturn(Mono.just(BUNDLE));
        when(rulesets.current(any(), anyLong())).thenReturn(Mono.just(currentRuleset()));
        when(rulesets.fundAccessLimits(any(), anyLong(), anyLong(), anyString())).thenReturn(Mono.just(
                new FundAccessLimits(List.of(new CurrencyAmount(BigInteger.valueOf(600), 1L)), List.of())));
        when(reader.usedPayoutLimit(any(), anyLong(), anyString(), anyString(), anyLong(), anyLong()))
                .thenReturn(Mono.just(BigInteger.valueOf(100)));
        when(reader.terminalBalance(any(), anyLong(), anyString(), anyString())).thenReturn(Mono.just(BigInteger.valueOf(1_000)));
        when(reader.totalSupplyOf(any(), anyLong())).thenReturn(Mono.just(BigInteger.valueOf(100)));
        when(reader.tokenOf(any(), anyLong())).thenReturn(Mono.empty());
        when(reader.suckersOf(any(), anyLong())).thenReturn(Mono.just(List.of("0x00000000000000000000000000000000000000ee")));
        when(indexer.recentPayEvents(anyLong(), any(), anyInt(), anyInt())).thenReturn(Mono.just(List.of(
                new PayEvent(BigInteger.valueOf(10), BigInteger.valueOf(80), 1L))));
    }

    @Test
    @DisplayName("group snapshot uses group aggregates and marks a failed chain as degraded")
    void groupSnapshot() {
        SuckerGroup group = new SuckerGroup("sg-1", BigInteger.valueOf(3_000), BigInteger.valueOf(9_000),
                BigInteger.valueOf(2_000), 12L, List.of(project(1L, "sg-1", 18), project(10L, "sg-1", 18)));
        when(indexer.project(3L, Chain.ETHEREUM, 5))
                .thenReturn(Mono.just(new IndexedProject(project(1L, "sg-1", 18), group)));
        when(reader.terminalBalance(eq(Chain.OPTIMISM), anyLong(), anyString(), anyString()))
                .thenReturn(Mono.error(new UpstreamException("op rpc down")));
        when(indexer.participantsByGroup("sg-1", Chain.ETHEREUM, IndexerClient.DEFAULT_PAGE_SIZE, null))
                .thenReturn(Mono.just(page(List.of(
                        new Participant(ALICE, 1L, BigInteger.valueOf(70)),
                        new Participant("0xb0b0000000000000000000000000000000000002", 1L, BigInteger.valueOf(20))), true, "c1")));
        when(indexer.participantsByGroup("sg-1", Chain.ETHEREUM, IndexerClient.DEFAULT_PAGE_SIZE, "c1"))
                .thenReturn(Mono.just(page(List.of(new Participant(ALICE, 10L, BigInteger.valueOf(30))), false, null)));

        TreasurySnapshot snapshot = aggregator.snapshot(3L, Chain.ETHEREUM, 5).block();

        assertThat(snapshot.totals().source()).isEqualTo(GroupTotals.Source.GROUP_AGGREGATE);
        assertThat(snapshot.totals().balance()).isEqualTo(BigInteger.valueOf(3_000));
        assertThat(snapshot.connectedChains()).containsExactly(1L, 10L);
        assertThat(snapshot.chains()).extracting(ChainTreasury::degraded).containsExactly(false, true);
        assertThat(snapshot.chains().get(0).payoutLimit()).isEqualTo(BigInteger.valueOf(600));
        assertThat(snapshot.payout().kind()).isEqualTo(PayoutCalculator.Kind.LIMITED);
        assertThat(snapshot.payout().available()).isEqualTo(BigInteger.valueOf(500));
        assertThat(snapshot.participants().get(0).address()).isEqualTo(ALICE);
        assertThat(snapshot.participants().get(0).balance()).isEqualTo(BigInteger.valueOf(100));
        assertThat(snapshot.participants().get(0).chains()).containsExactly(1L, 10L);
        assertThat(snapshot.participants().get(0).percent()).isEqualByComparingTo("5");
        assertThat(snapshot.floorPricePerToken()).isEqualTo(BigInteger.valueOf(3_000));
        assertThat(snapshot.payerIssuance()).isEqualTo(BigInteger.TEN.pow(18).multiply(BigInteger.valueOf(800)));
        assertThat(snapshot.observedIssuance().tokensPerUnit()).isEqualByComparingTo("8");
        assertThat(snapshot.tokenSymbol()).isEqualTo("NANA");
        assertThat(snapshot.suckers()).hasSize(1);
        assertThat(snapshot.degradedSlots()).isEmpty();
        assertThat(snapshot.isDegraded()).isTrue();
    }

    @Test
    @DisplayName("indexer outage degrades to a singleton built from chain reads")
    void indexerOutage() {
        when(indexer.project(anyLong(), any(), anyInt())).thenReturn(Mono.error(new UpstreamException("indexer down")));
        when(indexer.recentPayEvents(anyLong(), any(), anyInt(), anyInt()))
                .thenReturn(Mono.error(new UpstreamException("indexer down")));
        when(indexer.participantsByProject(anyLong(), any(), anyInt(), isNull()))
                .thenReturn(Mono.error(new UpstreamException("indexer down")));

        TreasurySnapshot snapshot = aggregator.snapshot(3L, Chain.ETHEREUM, 5).block();

        assertThat(snapshot.degradedSlots()).containsExactlyInAnyOrder("project", "payEvents", "participants");
        assertThat(snapshot.totals().source()).isEqualTo(GroupTotals.Source.ON_CHAIN);
        assertThat(snapshot.totals().balance()).isEqualTo(BigInteger.valueOf(1_000));
        assertThat(snapshot.connectedChains()).containsExactly(1L);
        assertThat(snapshot.participants()).isEmpty();
        assertThat(snapshot.observedIssuance()).isNull();
        assertThat(snapshot.currency()).isEqualTo(Currency.ETH);
    }

    @Test
    @DisplayName("group id without group data fetches the group")
    void fetchesGroupById() {
        when(indexer.project(3L, Chain.BASE, 5)).thenReturn(Mono.just(new IndexedProject(project(8453L, "sg-2", 6), null)));
        when(indexer.suckerGroup("sg-2", Chain.BASE)).thenReturn(Mono.just(new SuckerGroup("sg-2", null, null, null, null,
                List.of(project(8453L, "sg-2", 6), project(42161L, "sg-2", 6)))));
        when(indexer.participantsByGroup(eq("sg-2"), eq(Chain.BASE), anyInt(), isNull()))
                .thenReturn(Mono.just(page(List.of(), false, null)));

        TreasurySnapshot snapshot = aggregator.snapshot(3L, Chain.BASE, 5).block();

        assertThat(snapshot.suckerGroupId()).isEqualTo("sg-2");
        assertThat(snapshot.totals().source()).isEqualTo(GroupTotals.Source.MEMBER_SUM);
        assertThat(snapshot.connectedChains()).containsExactly(8453L, 42161L);
        assertThat(snapshot.currency()).isEqualTo(Currency.USD);
        assertThat(snapshot.decimals()).isEqualTo(6);
        verify(reader).terminalBalance(Chain.BASE, 3L, TERMINAL, JbContracts.usdc(Chain.BASE).orElseThrow());
    }

    @Test
    @DisplayName("a contract resolution failure fails the snapshot")
    void resolverFailureIsFatal() {
        when(resolver.resolve(3L, Chain.ARBITRUM)).thenReturn(Mono.error(new MissingEndpointException(42161L)));

        StepVerifier.create(aggregator.snapshot(3L, Chain.ARBITRUM, 5))
                .expectError(MissingEndpointException.class)
                .verify();
        verify(indexer, never()).project(anyLong(), any(), anyInt());
    }

    @Test
    void accountingToken_isUsdcOnlyForStableUnitProjects() {
        assertThat(SuckerGroupAggregator.accountingToken(Chain.OPTIMISM, Currency.USD))
                .isEqualTo(JbContracts.usdc(Chain.OPTIMISM).orElseThrow());
        assertThat(SuckerGroupAggregator.accountingToken(Chain.OPTIMISM, Currency.ETH)).isEqualTo(NATIVE);
    }

    @Test
    void accountingCurrency_sixDecimalMemberMeansUsd() {
        SuckerGroup group = new SuckerGroup("sg", null, null, null, null,
                List.of(project(1L, "sg", 18), project(10L, "sg", 6)));
        assertThat(SuckerGroupAggregator.accountingCurrency(project(1L, "sg", 18), group)).isEqualTo(Currency.USD);
        assertThat(SuckerGroupAggregator.accountingCurrency(null, null)).isEqualTo(Currency.ETH);
    }

    private static Ruleset currentRuleset() {
        RulesetMetadata metadata = new RulesetMetadata(2_000, 5_000, 1L,
                false, false, false, false, false, false, false, false, false, false, false, false, false, false, false,
                null, 0);
        return new Ruleset(4, 40, 0, 0, 604_800, WEIGHT, 0, null, RulesetMetadataCodec.encode(metadata));
    }

    private static Project project(long chainId, String groupId, int decimals) {
        return new Project(3L, chainId, 5, "nana", null, null, BigInteger.valueOf(1_500), BigInteger.valueOf(4_500),
                null, 6L, decimals, decimals == 6 ? 2 : 1, null, "NANA", BigInteger.valueOf(1_000), groupId, null);
    }

    private static ParticipantPage page(List<Participant> items, boolean hasNext, String cursor) {
        return new ParticipantPage(new Page<>(items, hasNext, cursor), items.size());
    }
}
