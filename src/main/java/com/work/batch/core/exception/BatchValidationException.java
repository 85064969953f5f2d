package com.work.batch.core.exception;

/**
 * 参数校验失败。一定在任何网络调用之前抛出，整批请求直接失败、不会部分执行。
 */
public class BatchValidationException extends BatchException {

    private final String field;
    private final String received;
    private final String suggestion;

    public BatchValidationException(BatchErrorCode errorCode, String field, String message, String received, String suggestion) {
        super(errorCode, message);
        this.field = field;
        this.received = received;
        this.suggestion = suggestion;
    }

    public static BatchValidationException missingField(String field) {
        return new BatchValidationException(BatchErrorCode.MISSING_REQUIRED_FIELD, field,
                "Missing required field: " + field, null,
                "Provide a value for the \"" + field + "\" parameter");
    }

    public static BatchValidationException custom(String field, String message, String received) {
        return new BatchValidationException(BatchErrorCode.INVALID_FORMAT, field, message, received, null);
    }

    public String getField() {
        return field;
    }

    public String getReceived() {
        return received;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
