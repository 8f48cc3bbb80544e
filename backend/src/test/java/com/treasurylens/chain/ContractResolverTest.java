package com.treasurylens.chain;

import com.treasurylens.common.MissingEndpointException;
import com.treasurylens.domain.Chain;
import org.junit.jupiter.api.Test;
import org.web3j.abi.datatypes.Address;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class ContractResolverTest {

    private static final String CONTROLLER_OF = "controllerOf(uint256)";

    private final StubRpcClient rpc = new StubRpcClient();
    private final ContractResolver resolver = new ContractResolver(ChainTestSupport.reader(rpc));

    @Test
    void v5Controller_resolvesToRevnetSuite() {
        rpc.respond(CONTROLLER_OF, new Address(JbContracts.JB_CONTROLLER_V5));

        ContractBundle bundle = resolver.resolve(3L, Chain.ETHEREUM).block();

        assertThat(bundle).isEqualTo(JbContracts.v5Bundle());
        assertThat(bundle.specialVariant()).isTrue();
        assertThat(bundle.terminal()).isEqualTo(JbContracts.JB_MULTI_TERMINAL_V5);
    }

    @Test
    void v51Controller_resolvesToCurrentSuite() {
        rpc.respond(CONTROLLER_OF, new Address(JbContracts.JB_CONTROLLER_V5_1));

        assertThat(resolver.resolve(3L, Chain.ETHEREUM).block()).isEqualTo(JbContracts.v51Bundle());
    }

    @Test
    void unknownController_keepsItsAddressWithCurrentSuite() {
        String custom = "0x00000000000000000000000000000000000C0FFE";
        rpc.respond(CONTROLLER_OF, new Address(custom));

        ContractBundle bundle = resolver.resolve(3L, Chain.ETHEREUM).block();

        assertThat(bundle.version()).isEqualTo(ContractVersion.UNKNOWN);
        assertThat(bundle.controller()).isEqualTo(custom.toLowerCase());
        assertThat(bundle.rulesets()).isEqualTo(JbContracts.JB_RULESETS_V5_1);
        assertThat(bundle.fallback()).isFalse();
    }

    @Test
    void zeroController_fallsBackToDefault() {
        rpc.respond(CONTROLLER_OF, new Address("0x0000000000000000000000000000000000000000"));

        ContractBundle bundle = resolver.resolve(3L, Chain.ETHEREUM).block();

        assertThat(bundle.fallback()).isTrue();
        assertThat(bundle.version()).isEqualTo(ContractVersion.V5_1);
    }

    @Test
    void failedRead_fallsBackToDefault() {
        rpc.down(ChainTestSupport.RPC_A).down(ChainTestSupport.RPC_B);

        assertThat(resolver.resolve(3L, Chain.ETHEREUM).block()).isEqualTo(JbContracts.defaultBundle());
    }

    @Test
    void missingEndpoint_propagates() {
        StepVerifier.create(resolver.resolve(3L, Chain.ARBITRUM))
                .expectError(MissingEndpointException.class)
                .verify();
    }

    @Test
    void classify_isCaseInsensitive() {
        assertThat(ContractResolver.classify(JbContracts.JB_CONTROLLER_V5.toUpperCase().replace("0X", "0x")))
                .isEqualTo(JbContracts.v5Bundle());
    }
}
