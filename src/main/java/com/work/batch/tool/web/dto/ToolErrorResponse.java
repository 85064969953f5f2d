package com.work.batch.tool.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 工具调用失败时的统一返回：{success:false, error:{code, message, details, recoverable, retryAfter}}。
 */
public class ToolErrorResponse {

    private final boolean success = false;
    private final ErrorBody error;

    public ToolErrorResponse(ErrorBody error) {
        this.error = error;
    }

    public boolean isSuccess() {
        return success;
    }

    public ErrorBody getError() {
        return error;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        private final int code;
        private final String message;
        private final ErrorDetails details;
        private final boolean recoverable;
        private final Integer retryAfter;

        public ErrorBody(int code, String message, ErrorDetails details, boolean recoverable, Integer retryAfter) {
            this.code = code;
            this.message = message;
            this.details = details;
            this.recoverable = recoverable;
            this.retryAfter = retryAfter;
        }

        public int getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        public ErrorDetails getDetails() {
            return details;
        }

        public boolean isRecoverable() {
            return recoverable;
        }

        public Integer getRetryAfter() {
            return retryAfter;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetails {
        private final String field;
        private final String expected;
        private final String received;
        private final String suggestion;

        public ErrorDetails(String field, String expected, String received, String suggestion) {
            this.field = field;
            this.expected = expected;
            this.received = received;
            this.suggestion = suggestion;
        }

        public String getField() {
            return field;
        }

        public String getExpected() {
            return expected;
        }

        public String getReceived() {
            return received;
        }

        public String getSuggestion() {
            return suggestion;
        }
    }
}
