package com.lendguard.chain;

/**
 * Thrown when a Starknet RPC call fails (HTTP, JSON-RPC error, timeout or malformed result).
 */
public class RpcException extends RuntimeException {

    private final boolean timeout;

    public RpcException(String message) {
        this(message, null, false);
    }

    public RpcException(String message, Throwable cause) {
        this(message, cause, false);
    }

    private RpcException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public static RpcException timeout(String message, Throwable cause) {
        return new RpcException(message, cause, true);
    }

    public boolean isTimeout() {
        return timeout;
    }
}
