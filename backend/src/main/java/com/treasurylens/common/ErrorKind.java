package com.treasurylens.common;

/**
 * Failure categories surfaced by the data layer. Not-found is not an error: services return empty.
 */
public enum ErrorKind {
    /** Dependency temporarily disabled by its circuit gate; a retry-after hint is available. */
    CIRCUIT_OPEN,
    /** Dependency reachable but returned an error or malformed data. */
    UPSTREAM,
    /** Packed/binary field outside its valid domain. */
    DECODE,
    NOT_FOUND,
    /** Required configuration missing, e.g. no RPC endpoint for a chain. */
    CONFIG
}
