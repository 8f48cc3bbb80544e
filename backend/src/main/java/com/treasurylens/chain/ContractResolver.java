package com.treasurylens.chain;

import com.treasurylens.common.Addresses;
import com.treasurylens.common.MissingEndpointException;
import com.treasurylens.domain.Chain;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.util.List;

/**
 * Determines which contract generation governs a project by reading JBDirectory.controllerOf on-chain and
 * classifying the controller. A failed read or zero controller degrades to {@link JbContracts#defaultBundle()}
 * with a warning; missing RPC configuration is not degraded and propagates.
 */
@Slf4j
@RequiredArgsConstructor
public class ContractResolver {

    private final ContractReader reader;

    public Mono<ContractBundle> resolve(long projectId, Chain chain) {
        Function controllerOf = new Function("controllerOf",
                List.of(new Uint256(BigInteger.valueOf(projectId))),
                List.of(new TypeReference<Address>() {}));
        return reader.callSingle(chain, JbContracts.JB_DIRECTORY, controllerOf, String.class)
                .map(controller -> {
                    if (Addresses.isZero(controller)) {
                        log.warn("No controller for project {} on chain {}, using default contracts", projectId, chain.getId());
                        return JbContracts.defaultBundle();
                    }
                    return classify(controller);
                })
                .onErrorResume(e -> !(e instanceof MissingEndpointException), e -> {
                    log.warn("controllerOf({}) on chain {} failed, using default contracts: {}",
                            projectId, chain.getId(), e.getMessage());
                    return Mono.just(JbContracts.defaultBundle());
                })
                .defaultIfEmpty(JbContracts.defaultBundle());
    }

    static ContractBundle classify(String controller) {
        if (Addresses.same(controller, JbContracts.JB_CONTROLLER_V5)) {
            return JbContracts.v5Bundle();
        }
        if (Addresses.same(controller, JbContracts.JB_CONTROLLER_V5_1)) {
            return JbContracts.v51Bundle();
        }
        return new ContractBundle(Addresses.normalize(controller), JbContracts.JB_RULESETS_V5_1,
                JbContracts.JB_MULTI_TERMINAL_V5_1, false, ContractVersion.UNKNOWN, false);
    }
}
