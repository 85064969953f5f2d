package com.work.batch.core.exception;

import java.time.Duration;

/**
 * 在配置的超时时间内没有等到交易回执。
 */
public class ConfirmationTimeoutException extends BatchException {

    private final String txHash;

    public ConfirmationTimeoutException(String txHash, Duration timeout) {
        super(BatchErrorCode.TRANSACTION_TIMEOUT,
                "Timed out after " + timeout.toMillis() + "ms waiting for transaction " + txHash);
        this.txHash = txHash;
    }

    public String getTxHash() {
        return txHash;
    }
}
