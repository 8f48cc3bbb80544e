package com.treasurylens.chain;

/**
 * Thrown when a single RPC call fails (HTTP or JSON-RPC error). Triggers fallback to the next endpoint.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
