package com.treasurylens.chain;

import com.treasurylens.chain.abi.JBCurrencyAmountStruct;
import com.treasurylens.chain.abi.JBSplitStruct;
import com.treasurylens.common.Addresses;
import com.treasurylens.domain.ApprovalStatus;
import com.treasurylens.domain.Chain;
import com.treasurylens.domain.CurrencyAmount;
import com.treasurylens.domain.FundAccessLimits;
import com.treasurylens.domain.QueuedRuleset;
import com.treasurylens.domain.Ruleset;
import com.treasurylens.domain.Split;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint112;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;
import org.web3j.abi.datatypes.generated.Uint48;
import org.web3j.abi.datatypes.generated.Uint8;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Protocol view functions: rulesets, splits, fund access limits, terminal store accounting, project tokens
 * and sucker peers. Rulesets and terminal addresses come from the project's {@link ContractBundle}.
 */
@Slf4j
@RequiredArgsConstructor
public class ProtocolReader {

    private final ContractReader reader;

    public Mono<Ruleset> currentOf(Chain chain, long projectId, ContractBundle bundle) {
        Function fn = new Function("currentOf", List.of(uint(projectId)), rulesetOutputs());
        return reader.call(chain, bundle.rulesets(), fn)
                .map(ProtocolReader::toRuleset)
                .filter(Ruleset::exists);
    }

    public Mono<Ruleset> getRulesetOf(Chain chain, long projectId, long rulesetId, ContractBundle bundle) {
        Function fn = new Function("getRulesetOf", List.of(uint(projectId), uint(rulesetId)), rulesetOutputs());
        return reader.call(chain, bundle.rulesets(), fn)
                .map(ProtocolReader::toRuleset)
                .filter(Ruleset::exists);
    }

    public Mono<QueuedRuleset> latestQueuedOf(Chain chain, long projectId, ContractBundle bundle) {
        List<TypeReference<?>> outputs = new ArrayList<>(rulesetOutputs());
        outputs.add(new TypeReference<Uint8>() {});
        Function fn = new Function("latestQueuedOf", List.of(uint(projectId)), outputs);
        return reader.call(chain, bundle.rulesets(), fn)
                .flatMap(values -> {
                    Ruleset ruleset = toRuleset(values);
                    if (!ruleset.exists()) {
                        return Mono.empty();
                    }
                    int status = ((BigInteger) values.get(9).getValue()).intValue();
                    return Mono.just(new QueuedRuleset(ruleset, ApprovalStatus.fromOrdinal(status)));
                });
    }

    @SuppressWarnings("unchecked")
    public Mono<List<Split>> splitsOf(Chain chain, long projectId, long rulesetId, BigInteger groupId) {
        Function fn = new Function("splitsOf",
                List.of(uint(projectId), uint(rulesetId), new Uint256(groupId)),
                List.of(new TypeReference<DynamicArray<JBSplitStruct>>() {}));
        return reader.call(chain, JbContracts.JB_SPLITS, fn)
                .map(values -> {
                    List<JBSplitStruct> structs = (List<JBSplitStruct>) values.get(0).getValue();
                    List<Split> splits = new ArrayList<>(structs.size());
                    for (JBSplitStruct s : structs) {
                        splits.add(new Split(s.percent.longValueExact(), s.projectId.longValueExact(),
                                Addresses.normalize(s.beneficiary), Boolean.TRUE.equals(s.preferAddToBalance),
                                s.lockedUntil.longValueExact(), Addresses.normalize(s.hook)));
                    }
                    return splits;
                });
    }

    public Mono<List<Split>> reservedSplits(Chain chain, long projectId, long rulesetId) {
        return splitsOf(chain, projectId, rulesetId, JbContracts.RESERVED_TOKENS_GROUP);
    }

    /**
     * Payout splits grouped under the native token; projects accounting in USDC keep them under the USDC group,
     * which is tried when the native group is empty.
     */
    public Mono<List<Split>> payoutSplits(Chain chain, long projectId, long rulesetId) {
        Mono<List<Split>> nativeGroup = splitsOf(chain, projectId, rulesetId, JbContracts.payoutGroupOf(JbContracts.NATIVE_TOKEN));
        Optional<String> usdc = JbContracts.usdc(chain);
        if (usdc.isEmpty()) {
            return nativeGroup;
        }
        return nativeGroup.flatMap(splits -> splits.isEmpty()
                ? splitsOf(chain, projectId, rulesetId, JbContracts.payoutGroupOf(usdc.get()))
                : Mono.just(splits));
    }

    public Mono<FundAccessLimits> fundAccessLimits(Chain chain, long projectId, long rulesetId, String terminal, String token) {
        return Mono.zip(
                        currencyAmounts(chain, "payoutLimitsOf", projectId, rulesetId, terminal, token),
                        currencyAmounts(chain, "surplusAllowancesOf", projectId, rulesetId, terminal, token))
                .map(t -> new FundAccessLimits(t.getT1(), t.getT2()));
    }

    @SuppressWarnings("unchecked")
    private Mono<List<CurrencyAmount>> currencyAmounts(Chain chain, String functionName, long projectId, long rulesetId,
                                                       String terminal, String token) {
        Function fn = new Function(functionName,
                List.of(uint(projectId), uint(rulesetId), new Address(terminal), new Address(token)),
                List.of(new TypeReference<DynamicArray<JBCurrencyAmountStruct>>() {}));
        return reader.call(chain, JbContracts.JB_FUND_ACCESS_LIMITS, fn)
                .map(values -> {
                    List<JBCurrencyAmountStruct> structs = (List<JBCurrencyAmountStruct>) values.get(0).getValue();
                    List<CurrencyAmount> amounts = new ArrayList<>(structs.size());
                    for (JBCurrencyAmountStruct s : structs) {
                        amounts.add(new CurrencyAmount(s.amount, s.currency.longValueExact()));
                    }
                    return amounts;
                });
    }

    /**
     * Terminal store used by a terminal for its accounting.
     */
    public Mono<String> storeOf(Chain chain, String terminal) {
        Function fn = new Function("STORE", List.of(), List.of(new TypeReference<Address>() {}));
        return reader.callSingle(chain, terminal, fn, String.class);
    }

    public Mono<BigInteger> terminalBalance(Chain chain, long projectId, String terminal, String token) {
        return storeOf(chain, terminal).flatMap(store -> {
            Function fn = new Function("balanceOf",
                    List.of(new Address(terminal), uint(projectId), new Address(token)),
                    List.of(new TypeReference<Uint256>() {}));
            return reader.callSingle(chain, store, fn, BigInteger.class);
        });
    }

    public Mono<BigInteger> usedPayoutLimit(Chain chain, long projectId, String terminal, String token,
                                            long cycleNumber, long currency) {
        return storeOf(chain, terminal).flatMap(store -> {
            Function fn = new Function("usedPayoutLimitOf",
                    List.of(new Address(terminal), uint(projectId), new Address(token), uint(cycleNumber), uint(currency)),
                    List.of(new TypeReference<Uint256>() {}));
            return reader.callSingle(chain, store, fn, BigInteger.class);
        });
    }

    /**
     * ERC-20 deployed for the project; empty when the project only has credits.
     */
    public Mono<String> tokenOf(Chain chain, long projectId) {
        Function fn = new Function("tokenOf", List.of(uint(projectId)), List.of(new TypeReference<Address>() {}));
        return reader.callSingle(chain, JbContracts.JB_TOKENS, fn, String.class)
                .filter(token -> !Addresses.isZero(token))
                .map(Addresses::normalize);
    }

    /**
     * Token plus unclaimed credit supply.
     */
    public Mono<BigInteger> totalSupplyOf(Chain chain, long projectId) {
        Function fn = new Function("totalSupplyOf", List.of(uint(projectId)), List.of(new TypeReference<Uint256>() {}));
        return reader.callSingle(chain, JbContracts.JB_TOKENS, fn, BigInteger.class);
    }

    public Mono<String> erc20Symbol(Chain chain, String token) {
        Function fn = new Function("symbol", List.of(), List.of(new TypeReference<Utf8String>() {}));
        return reader.callSingle(chain, token, fn, String.class);
    }

    public Mono<BigInteger> erc20TotalSupply(Chain chain, String token) {
        Function fn = new Function("totalSupply", List.of(), List.of(new TypeReference<Uint256>() {}));
        return reader.callSingle(chain, token, fn, BigInteger.class);
    }

    @SuppressWarnings("unchecked")
    public Mono<List<String>> suckersOf(Chain chain, long projectId) {
        Function fn = new Function("suckersOf", List.of(uint(projectId)),
                List.of(new TypeReference<DynamicArray<Address>>() {}));
        return reader.call(chain, JbContracts.JB_SUCKER_REGISTRY, fn)
                .map(values -> ((List<Address>) values.get(0).getValue()).stream()
                        .map(a -> Addresses.normalize(a.getValue()))
                        .toList());
    }

    private static List<TypeReference<?>> rulesetOutputs() {
        return List.of(
                new TypeReference<Uint48>() {},
                new TypeReference<Uint48>() {},
                new TypeReference<Uint48>() {},
                new TypeReference<Uint48>() {},
                new TypeReference<Uint32>() {},
                new TypeReference<Uint112>() {},
                new TypeReference<Uint32>() {},
                new TypeReference<Address>() {},
                new TypeReference<Uint256>() {});
    }

    @SuppressWarnings("rawtypes")
    static Ruleset toRuleset(List<Type> v) {
        return new Ruleset(
                asLong(v.get(0)),
                asLong(v.get(1)),
                asLong(v.get(2)),
                asLong(v.get(3)),
                asLong(v.get(4)),
                (BigInteger) v.get(5).getValue(),
                asLong(v.get(6)),
                Addresses.normalize((String) v.get(7).getValue()),
                (BigInteger) v.get(8).getValue());
    }

    @SuppressWarnings("rawtypes")
    private static long asLong(Type value) {
        return ((BigInteger) value.getValue()).longValueExact();
    }

    private static Uint256 uint(long value) {
        return new Uint256(BigInteger.valueOf(value));
    }
}
