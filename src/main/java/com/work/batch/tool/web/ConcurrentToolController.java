package com.work.batch.tool.web;

import com.work.batch.core.exception.BatchErrorCode;
import com.work.batch.core.exception.BatchException;
import com.work.batch.core.exception.BatchValidationException;
import com.work.batch.core.exception.ChainNetworkException;
import com.work.batch.tool.service.ConcurrentPaymentToolService;
import com.work.batch.tool.web.dto.ActiveNonceKeysResponse;
import com.work.batch.tool.web.dto.ConcurrentPaymentsResponse;
import com.work.batch.tool.web.dto.NonceForKeyResponse;
import com.work.batch.tool.web.dto.SendConcurrentPaymentsRequest;
import com.work.batch.tool.web.dto.ToolErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 并发交易相关的三个工具：
 * - send_concurrent_payments（高风险，会真实发送交易）
 * - get_nonce_for_key / list_active_nonce_keys（只读）
 *
 * 注意：没有请求级幂等键。部分失败后重试请换一个 startNonceKey，
 * 否则可能与上一轮仍在 pending 的交易使用相同的 nonceKey。
 */
@RestController
@RequestMapping("/api/v1/tools")
public class ConcurrentToolController {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentToolController.class);

    private final ConcurrentPaymentToolService toolService;

    public ConcurrentToolController(ConcurrentPaymentToolService toolService) {
        this.toolService = toolService;
    }

    @PostMapping("/send_concurrent_payments")
    public ResponseEntity<ConcurrentPaymentsResponse> sendConcurrentPayments(@Validated @RequestBody SendConcurrentPaymentsRequest req) {
        return ResponseEntity.ok(toolService.sendConcurrentPayments(req));
    }

    @GetMapping("/get_nonce_for_key")
    public ResponseEntity<NonceForKeyResponse> getNonceForKey(@RequestParam("nonceKey") int nonceKey,
                                                              @RequestParam(value = "address", required = false) String address) {
        return ResponseEntity.ok(toolService.getNonceForKey(nonceKey, address));
    }

    @GetMapping("/list_active_nonce_keys")
    public ResponseEntity<ActiveNonceKeysResponse> listActiveNonceKeys(@RequestParam(value = "address", required = false) String address) {
        return ResponseEntity.ok(toolService.listActiveNonceKeys(address));
    }

    @ExceptionHandler(BatchValidationException.class)
    public ResponseEntity<ToolErrorResponse> handleValidation(BatchValidationException e) {
        ToolErrorResponse.ErrorDetails details = new ToolErrorResponse.ErrorDetails(
                e.getField(), null, e.getReceived(), e.getSuggestion());
        return error(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage(), details);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ToolErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        FieldError fe = e.getBindingResult().getFieldError();
        String field = fe == null ? null : fe.getField();
        String message = fe == null ? "Invalid request" : fe.getDefaultMessage();
        String received = fe == null || fe.getRejectedValue() == null ? null : String.valueOf(fe.getRejectedValue());
        return error(HttpStatus.BAD_REQUEST, BatchErrorCode.INVALID_FORMAT, message,
                new ToolErrorResponse.ErrorDetails(field, null, received, null));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ToolErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.debug("unreadable request body err={}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, BatchErrorCode.INVALID_FORMAT, "Malformed JSON request body",
                new ToolErrorResponse.ErrorDetails(null, "valid JSON object", null, null));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ToolErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        String expected = e.getRequiredType() == null ? null : e.getRequiredType().getSimpleName();
        String received = e.getValue() == null ? null : String.valueOf(e.getValue());
        return error(HttpStatus.BAD_REQUEST, BatchErrorCode.INVALID_FORMAT, "Invalid value for " + e.getName(),
                new ToolErrorResponse.ErrorDetails(e.getName(), expected, received, null));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ToolErrorResponse> handleMissingParam(MissingServletRequestParameterException e) {
        BatchValidationException v = BatchValidationException.missingField(e.getParameterName());
        return handleValidation(v);
    }

    @ExceptionHandler(ChainNetworkException.class)
    public ResponseEntity<ToolErrorResponse> handleNetwork(ChainNetworkException e) {
        log.warn("chain request failed err={}", e.getMessage());
        return error(HttpStatus.BAD_GATEWAY, e.getErrorCode(), e.getMessage(), null);
    }

    @ExceptionHandler(BatchException.class)
    public ResponseEntity<ToolErrorResponse> handleBatch(BatchException e) {
        log.error("tool call failed code={}", e.getErrorCode().getCode(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage(), null);
    }

    /**
     * 兜底：其余运行时异常统一为 5000。405/415 等 Spring MVC 自身的受检异常仍走框架默认处理。
     */
    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ToolErrorResponse> handleUnexpected(RuntimeException e) {
        log.error("tool call failed unexpectedly", e);
        String message = e.getMessage() == null ? "Internal error" : e.getMessage();
        return error(HttpStatus.INTERNAL_SERVER_ERROR, BatchErrorCode.INTERNAL_ERROR, message, null);
    }

    private ResponseEntity<ToolErrorResponse> error(HttpStatus status, BatchErrorCode code, String message,
                                                    ToolErrorResponse.ErrorDetails details) {
        ToolErrorResponse body = new ToolErrorResponse(new ToolErrorResponse.ErrorBody(
                code.getCode(), message, details, code.isRecoverable(), null));
        return ResponseEntity.status(status).body(body);
    }
}
