package com.work.batch.core.exception;

/**
 * 错误码分段：
 * 1000-1999 参数校验；3000-3999 链上执行；4000-4999 网络/RPC；5000-5999 内部错误。
 */
public enum BatchErrorCode {
    INVALID_ADDRESS(1001, false),
    INVALID_AMOUNT(1002, false),
    INVALID_TOKEN(1003, false),
    INVALID_MEMO(1004, false),
    MISSING_REQUIRED_FIELD(1006, false),
    INVALID_FORMAT(1007, false),

    INSUFFICIENT_BALANCE(3001, false),
    TRANSACTION_REVERTED(3003, false),
    NONCE_TOO_LOW(3004, true),
    TRANSACTION_TIMEOUT(3005, true),
    CONTRACT_ERROR(3006, false),

    RPC_REQUEST_FAILED(4002, true),
    RPC_TIMEOUT(4003, true),

    INTERNAL_ERROR(5000, false),
    CONFIGURATION_ERROR(5001, false);

    private final int code;
    private final boolean recoverable;

    BatchErrorCode(int code, boolean recoverable) {
        this.code = code;
        this.recoverable = recoverable;
    }

    public int getCode() {
        return code;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
