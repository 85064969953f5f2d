package com.work.batch.core.exception;

/**
 * RPC 调用失败（连接失败、读超时、节点返回 error 等），可重试。
 */
public class ChainNetworkException extends BatchException {

    public ChainNetworkException(String message) {
        super(BatchErrorCode.RPC_REQUEST_FAILED, message);
    }

    public ChainNetworkException(String message, Throwable cause) {
        super(BatchErrorCode.RPC_REQUEST_FAILED, message, cause);
    }

    private ChainNetworkException(BatchErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    /**
     * 节点在读超时内没有响应。
     */
    public static ChainNetworkException timeout(String message, Throwable cause) {
        return new ChainNetworkException(BatchErrorCode.RPC_TIMEOUT, message, cause);
    }
}
