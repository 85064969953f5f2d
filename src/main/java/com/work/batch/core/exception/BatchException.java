package com.work.batch.core.exception;

/**
 * 组件内部的统一异常类型，便于业务侧捕获或转换为工具层错误码。
 */
public class BatchException extends RuntimeException {

    private final BatchErrorCode errorCode;

    public BatchException(BatchErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BatchException(BatchErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public BatchErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 标识该异常是否可通过重试解决（网络抖动、确认超时等）。
     * 默认取错误码上的标记。
     */
    public boolean isRetryable() {
        return errorCode.isRecoverable();
    }
}
