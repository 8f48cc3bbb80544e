package com.treasurylens.common;

/**
 * Indexer or RPC answered with an error, malformed payload, or every endpoint failed.
 */
public class UpstreamException extends TreasuryDataException {

    public UpstreamException(String message) {
        super(ErrorKind.UPSTREAM, message);
    }

    public UpstreamException(String message, Throwable cause) {
        super(ErrorKind.UPSTREAM, message, cause);
    }
}
