package com.treasurylens.aggregation;

import com.treasurylens.chain.ContractBundle;
import com.treasurylens.chain.ContractResolver;
import com.treasurylens.chain.JbContracts;
import com.treasurylens.chain.ProtocolReader;
import com.treasurylens.common.TreasuryDataException;
import com.treasurylens.domain.Chain;
import com.treasurylens.domain.Currency;
import com.treasurylens.domain.CurrencyAmount;
import com.treasurylens.domain.GroupParticipant;
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
import com.treasurylens.treasury.FloorPriceCalculator;
import com.treasurylens.treasury.IssuanceCalculator;
import com.treasurylens.treasury.PayoutCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Builds a {@link TreasurySnapshot} for a project and its sucker group.
 * <p>
 * The contract bundle is resolved first and is load-bearing: its failure fails the snapshot. Every other input is a
 * slot that degrades to empty with a warning. Indexer project, current ruleset, recent payments, token symbol and
 * sucker peers are read concurrently; once group membership is known, per-chain treasury reads and the holder list
 * follow, also concurrently. A failed per-chain read yields a zeroed, degraded {@link ChainTreasury}.
 */
@Slf4j
@RequiredArgsConstructor
public class SuckerGroupAggregator {

    static final int MAX_PARTICIPANT_PAGES = 10;

    private final ContractResolver resolver;
    private final ProtocolReader reader;
    private final RulesetService rulesets;
    private final IndexerClient indexer;

    public Mono<TreasurySnapshot> snapshot(long projectId, Chain chain, int version) {
        return resolver.resolve(projectId, chain).flatMap(bundle -> {
            List<String> degraded = new CopyOnWriteArrayList<>();
            Mono<Optional<IndexedProject>> indexed = slot("project", projectId, chain, degraded,
                    indexer.project(projectId, chain, version));
            Mono<Optional<Ruleset>> ruleset = slot("ruleset", projectId, chain, degraded,
                    rulesets.current(chain, projectId));
            Mono<Optional<List<PayEvent>>> payEvents = slot("payEvents", projectId, chain, degraded,
                    indexer.recentPayEvents(projectId, chain, version, IndexerClient.RECENT_PAY_EVENTS));
            Mono<Optional<String>> symbol = slot("tokenSymbol", projectId, chain, degraded,
                    reader.tokenOf(chain, projectId).flatMap(token -> reader.erc20Symbol(chain, token)));
            Mono<Optional<List<String>>> suckers = slot("suckers", projectId, chain, degraded,
                    reader.suckersOf(chain, projectId));

            return Mono.zip(indexed, ruleset, payEvents, symbol, suckers)
                    .flatMap(t -> membership(projectId, chain, t.getT1(), degraded)
                            .flatMap(group -> Mono.zip(
                                            chainTreasuries(group),
                                            participants(projectId, chain, group, degraded))
                                    .map(reads -> assemble(projectId, chain, version, bundle, group,
                                            reads.getT1(), reads.getT2(), t.getT2().orElse(null),
                                            t.getT3().orElse(List.of()), t.getT4().orElse(null),
                                            t.getT5().orElse(List.of()), degraded))));
        });
    }

    /**
     * Group members and accounting currency. The group is taken from the project response, fetched by id when only
     * the id came back, or absent (singleton).
     */
    private Mono<Membership> membership(long projectId, Chain chain, Optional<IndexedProject> indexed, List<String> degraded) {
        if (indexed.isEmpty()) {
            return Mono.just(Membership.of(null, null, projectId, chain));
        }
        Project seed = indexed.get().project();
        Optional<SuckerGroup> group = indexed.get().group();
        if (group.isPresent() || !seed.hasSuckerGroup()) {
            return Mono.just(Membership.of(seed, group.orElse(null), projectId, chain));
        }
        return slot("suckerGroup", projectId, chain, degraded, indexer.suckerGroup(seed.suckerGroupId(), chain))
                .map(fetched -> Membership.of(seed, fetched.orElse(null), projectId, chain));
    }

    private Mono<List<ChainTreasury>> chainTreasuries(Membership group) {
        return Flux.fromIterable(group.members())
                .flatMapSequential(member -> chainTreasury(member, group.currency()))
                .collectList();
    }

    private Mono<ChainTreasury> chainTreasury(Member member, Currency currency) {
        Chain chain = member.chain();
        long projectId = member.projectId();
        return resolver.resolve(projectId, chain)
                .flatMap(bundle -> {
                    String token = accountingToken(chain, currency);
                    return Mono.zip(
                            reader.terminalBalance(chain, projectId, bundle.terminal(), token),
                            reader.totalSupplyOf(chain, projectId),
                            payoutUsage(chain, projectId, bundle, token));
                })
                .map(t -> new ChainTreasury(chain.getId(), projectId, t.getT1(), t.getT3().limit(), t.getT3().used(),
                        t.getT2(), false))
                .onErrorResume(e -> {
                    log.warn("Treasury read for project {} on chain {} failed, reporting zero: {}",
                            projectId, chain.getId(), e.getMessage());
                    return Mono.just(ChainTreasury.degraded(chain.getId(), projectId));
                })
                .defaultIfEmpty(ChainTreasury.degraded(chain.getId(), projectId));
    }

    /**
     * Payout limit and amount used in the current cycle; a project without a ruleset or payout limit has none.
     */
    private Mono<PayoutUsage> payoutUsage(Chain chain, long projectId, ContractBundle bundle, String token) {
        PayoutUsage none = new PayoutUsage(BigInteger.ZERO, BigInteger.ZERO);
        return rulesets.current(chain, projectId)
                .flatMap(current -> rulesets.fundAccessLimits(chain, projectId, current.id(), token)
                        .flatMap(limits -> {
                            if (limits.payoutLimits().isEmpty()) {
                                return Mono.just(none);
                            }
                            CurrencyAmount limit = limits.payoutLimits().get(0);
                            return reader.usedPayoutLimit(chain, projectId, bundle.terminal(), token,
                                            current.cycleNumber(), limit.currency())
                                    .map(used -> new PayoutUsage(limit.amount(), used));
                        }))
                .defaultIfEmpty(none);
    }

    private Mono<List<Participant>> participants(long projectId, Chain chain, Membership group, List<String> degraded) {
        Function<String, Mono<ParticipantPage>> fetch = group.suckerGroup() != null
                ? after -> indexer.participantsByGroup(group.suckerGroup().id(), chain, IndexerClient.DEFAULT_PAGE_SIZE, after)
                : after -> indexer.participantsByProject(projectId, chain, IndexerClient.DEFAULT_PAGE_SIZE, after);
        Mono<List<Participant>> rows = fetch.apply(null)
                .expand(page -> page.page().hasNextPage() && page.page().endCursor() != null
                        ? fetch.apply(page.page().endCursor())
                        : Mono.empty())
                .take(MAX_PARTICIPANT_PAGES)
                .flatMapIterable(page -> page.page().items())
                .collectList();
        return slot("participants", projectId, chain, degraded, rows)
                .map(found -> found.orElse(List.of()));
    }

    private TreasurySnapshot assemble(long projectId, Chain chain, int version, ContractBundle bundle, Membership group,
                                      List<ChainTreasury> chains, List<Participant> holders, Ruleset current,
                                      List<PayEvent> payEvents, String symbol, List<String> suckers,
                                      List<String> degraded) {
        GroupTotals totals = GroupTotals.of(group.seed(), group.suckerGroup(), chains);
        List<GroupParticipant> participants = ParticipantMerger.merge(holders, totals.tokenSupply());
        RulesetMetadata metadata = null;
        if (current != null) {
            try {
                metadata = RulesetMetadataCodec.decode(current.metadata());
            } catch (TreasuryDataException e) {
                log.warn("Ruleset {} of project {} on chain {} has undecodable metadata: {}",
                        current.id(), projectId, chain.getId(), e.getMessage());
                degraded.add("metadata");
            }
        }
        BigInteger floorPrice = metadata != null
                ? FloorPriceCalculator.floorPricePerToken(totals.balance(), totals.tokenSupply(), metadata.cashOutTaxRate())
                : null;
        BigInteger payerIssuance = metadata != null
                ? IssuanceCalculator.payerIssuance(current.weight(), metadata.reservedPercent())
                : null;
        PayoutCalculator.Payout payout = chains.stream()
                .filter(c -> c.chainId() == chain.getId() && !c.degraded())
                .findFirst()
                .map(c -> PayoutCalculator.evaluate(c.payoutLimit(), c.usedPayout(), c.balance()))
                .orElse(null);
        Project seed = group.seed();
        return new TreasurySnapshot(
                projectId,
                chain.getId(),
                version,
                bundle,
                seed != null ? seed.handle() : null,
                group.suckerGroup() != null ? group.suckerGroup().id() : null,
                group.currency(),
                seed != null && seed.decimals() != null ? seed.decimals() : group.currency().getDefaultDecimals(),
                symbol != null ? symbol : seed != null ? seed.tokenSymbol() : null,
                totals,
                chains,
                group.members().stream().map(m -> m.chain().getId()).distinct().toList(),
                suckers,
                participants,
                current,
                metadata,
                floorPrice,
                payerIssuance,
                IssuanceCalculator.observedRate(payEvents).orElse(null),
                payout,
                List.copyOf(degraded));
    }

    /**
     * Stable-unit projects hold their treasury in USDC where the chain has it; everything else in the native token.
     */
    static String accountingToken(Chain chain, Currency currency) {
        if (currency == Currency.USD) {
            return JbContracts.usdc(chain).orElse(JbContracts.NATIVE_TOKEN);
        }
        return JbContracts.NATIVE_TOKEN;
    }

    /**
     * A member with 6 decimals means the stable unit, whatever its currency code says; otherwise the seed decides.
     */
    static Currency accountingCurrency(Project seed, SuckerGroup group) {
        if (group != null) {
            for (Project member : group.projects()) {
                if (member.decimals() != null && member.decimals() == 6) {
                    return Currency.USD;
                }
            }
        }
        return seed != null ? seed.accountingCurrency() : Currency.ETH;
    }

    private static <T> Mono<Optional<T>> slot(String name, long projectId, Chain chain, List<String> degraded, Mono<T> source) {
        return source
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .onErrorResume(e -> {
                    log.warn("Snapshot slot '{}' for project {} on chain {} unavailable: {}",
                            name, projectId, chain.getId(), e.getMessage());
                    degraded.add(name);
                    return Mono.just(Optional.<T>empty());
                });
    }

    record Member(Chain chain, long projectId) {
    }

    record PayoutUsage(BigInteger limit, BigInteger used) {
    }

    /**
     * Seed project, its group (null for a singleton), members on supported chains, and the accounting currency.
     */
    record Membership(Project seed, SuckerGroup suckerGroup, List<Member> members, Currency currency) {

        static Membership of(Project seed, SuckerGroup group, long projectId, Chain chain) {
            Map<Long, Member> members = new LinkedHashMap<>();
            members.put(chain.getId(), new Member(chain, projectId));
            if (group != null) {
                for (Project p : group.projects()) {
                    Optional<Chain> memberChain = Chain.fromId(p.chainId());
                    if (memberChain.isEmpty()) {
                        log.debug("Skipping group member on unsupported chain {}", p.chainId());
                        continue;
                    }
                    members.putIfAbsent(p.chainId(), new Member(memberChain.get(), p.projectId()));
                }
            }
            return new Membership(seed, group, List.copyOf(members.values()), accountingCurrency(seed, group));
        }
    }
}
