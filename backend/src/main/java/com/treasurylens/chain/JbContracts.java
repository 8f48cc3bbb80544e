package com.treasurylens.chain;

import com.treasurylens.common.Addresses;
import com.treasurylens.domain.Chain;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * Protocol contract addresses. Core contracts are deployed with CREATE2, so they are identical on every
 * supported chain, mainnet and testnet.
 */
public final class JbContracts {

    public static final String JB_DIRECTORY = "0x0061e516886a0540f63157f112c0588ee0651dcf";
    public static final String JB_SPLITS = "0x7160a322fea44945a6ef9adfd65c322258df3c5e";
    public static final String JB_FUND_ACCESS_LIMITS = "0x3a46b21720c8b70184b0434a2293b2fdcc497ce7";
    public static final String JB_TOKENS = "0x4d0edd347fb1fa21589c1e109b3474924be87636";
    public static final String JB_PRICES = "0x6e92e3b5ce1e7a4344c6d27c0c54efd00df92fb6";
    public static final String JB_SUCKER_REGISTRY = "0x696c7e794fe2a7c2e3b7da4ae91733345fc1bf68";
    public static final String REV_DEPLOYER = "0x2ca27bde7e7d33e353b44c27acfcf6c78dde251d";

    public static final String JB_CONTROLLER_V5 = "0x27da30646502e2f642be5281322ae8c394f7668a";
    public static final String JB_RULESETS_V5 = "0x6292281d69c3593fcf6ea074e5797341476ab428";
    public static final String JB_MULTI_TERMINAL_V5 = "0x2db6d704058e552defe415753465df8df0361846";

    public static final String JB_CONTROLLER_V5_1 = "0xf3cc99b11bd73a2e3b8815fb85fe0381b29987e1";
    public static final String JB_RULESETS_V5_1 = "0xd4257005ca8d27bbe11f356453b0e4692414b056";
    public static final String JB_MULTI_TERMINAL_V5_1 = "0x52869db3d61dde1e391967f2ce5039ad0ecd371c";

    /** Sentinel token address for the chain's native currency. */
    public static final String NATIVE_TOKEN = "0x000000000000000000000000000000000000eeee";

    /** Split group holding reserved-token splits; payout groups are keyed by token address. */
    public static final BigInteger RESERVED_TOKENS_GROUP = BigInteger.ONE;

    private static final Map<Chain, String> USDC = Map.of(
            Chain.ETHEREUM, "0xa0b86991c6218b36c1d19d4a2e9eb0ce3606eb48",
            Chain.OPTIMISM, "0x0b2c639c533813f4aa9d7837caf62653d097ff85",
            Chain.BASE, "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913",
            Chain.ARBITRUM, "0xaf88d065e77c8cc2239327c5edb3a432268e5831",
            Chain.ETHEREUM_SEPOLIA, "0x1c7d4b196cb0c7b01d743fbc6116a902379c7238",
            Chain.OPTIMISM_SEPOLIA, "0x5fd84259d66cd46123540766be93dfe6d43130d7",
            Chain.BASE_SEPOLIA, "0x036cbd53842c5426634e7929541ec2318f3dcf7e",
            Chain.ARBITRUM_SEPOLIA, "0x75faf114eafb1bdbe2f0316df893fd58ce46aa4d"
    );

    private JbContracts() {
    }

    public static Optional<String> usdc(Chain chain) {
        return Optional.ofNullable(USDC.get(chain));
    }

    /**
     * Payout split group id for a token: the address as uint160.
     */
    public static BigInteger payoutGroupOf(String token) {
        return new BigInteger(Addresses.normalize(token).substring(2), 16);
    }

    public static ContractBundle v5Bundle() {
        return new ContractBundle(JB_CONTROLLER_V5, JB_RULESETS_V5, JB_MULTI_TERMINAL_V5, true, ContractVersion.V5, false);
    }

    public static ContractBundle v51Bundle() {
        return new ContractBundle(JB_CONTROLLER_V5_1, JB_RULESETS_V5_1, JB_MULTI_TERMINAL_V5_1, false, ContractVersion.V5_1, false);
    }

    /**
     * Bundle used when the directory cannot be read or names no controller.
     */
    public static ContractBundle defaultBundle() {
        return new ContractBundle(JB_CONTROLLER_V5_1, JB_RULESETS_V5_1, JB_MULTI_TERMINAL_V5_1, false, ContractVersion.V5_1, true);
    }
}
