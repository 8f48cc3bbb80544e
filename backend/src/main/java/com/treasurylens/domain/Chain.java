package com.treasurylens.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported chains. Testnets point at the mainnet whose indexer and RPC config they may be routed to.
 */
public enum Chain {
    ETHEREUM(1L, 0L),
    OPTIMISM(10L, 0L),
    BASE(8453L, 0L),
    ARBITRUM(42161L, 0L),
    ETHEREUM_SEPOLIA(11155111L, 1L),
    OPTIMISM_SEPOLIA(11155420L, 10L),
    BASE_SEPOLIA(84532L, 8453L),
    ARBITRUM_SEPOLIA(421614L, 42161L);

    private final long id;
    private final long mainnetId;

    Chain(long id, long mainnetId) {
        this.id = id;
        this.mainnetId = mainnetId;
    }

    public long getId() {
        return id;
    }

    public boolean isTestnet() {
        return mainnetId != 0L;
    }

    /**
     * Mainnet counterpart; a mainnet returns itself.
     */
    public Chain mainnet() {
        return isTestnet() ? fromId(mainnetId).orElseThrow() : this;
    }

    public static Optional<Chain> fromId(long chainId) {
        return Arrays.stream(values()).filter(c -> c.id == chainId).findFirst();
    }

    /**
     * Parses a numeric chain id; fails with IllegalArgumentException for unknown chains.
     */
    public static Chain require(long chainId) {
        return fromId(chainId).orElseThrow(() -> new IllegalArgumentException("Unsupported chain: " + chainId));
    }
}
