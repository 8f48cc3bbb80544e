package com.treasurylens.common;

/**
 * No RPC endpoint configured for the requested chain.
 */
public class MissingEndpointException extends TreasuryDataException {

    private final long chainId;

    public MissingEndpointException(long chainId) {
        super(ErrorKind.CONFIG, "No RPC endpoint configured for chain " + chainId);
        this.chainId = chainId;
    }

    public long getChainId() {
        return chainId;
    }
}
