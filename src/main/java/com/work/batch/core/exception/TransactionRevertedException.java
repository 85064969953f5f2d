package com.work.batch.core.exception;

/**
 * 回执已出现但 status=0x0：nonce 已被链消耗，交易执行失败。
 */
public class TransactionRevertedException extends BatchException {

    private final String txHash;

    public TransactionRevertedException(String txHash, String reason) {
        super(BatchErrorCode.TRANSACTION_REVERTED, reason == null
                ? "Transaction reverted: " + txHash
                : "Transaction reverted: " + txHash + " (" + reason + ")");
        this.txHash = txHash;
    }

    public String getTxHash() {
        return txHash;
    }
}
