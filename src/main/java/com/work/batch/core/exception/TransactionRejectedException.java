package com.work.batch.core.exception;

/**
 * 节点拒绝接收交易（余额不足、nonce 过低、合约预检失败等），拒绝原因保留在 message 中。
 */
public class TransactionRejectedException extends BatchException {

    public TransactionRejectedException(BatchErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public TransactionRejectedException(String message) {
        super(BatchErrorCode.CONTRACT_ERROR, message);
    }

    /**
     * 按节点返回的错误文本粗分错误码，文本本身原样保留。
     */
    public static TransactionRejectedException fromNodeMessage(String message) {
        String m = message == null ? "" : message.toLowerCase();
        if (m.contains("nonce too low")) {
            return new TransactionRejectedException(BatchErrorCode.NONCE_TOO_LOW, message);
        }
        if (m.contains("insufficient funds") || m.contains("insufficient balance")) {
            return new TransactionRejectedException(BatchErrorCode.INSUFFICIENT_BALANCE, message);
        }
        return new TransactionRejectedException(message == null ? "Transaction rejected" : message);
    }
}
