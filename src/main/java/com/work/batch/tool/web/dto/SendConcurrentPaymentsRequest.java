package com.work.batch.tool.web.dto;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;
import java.util.List;

/**
 * send_concurrent_payments 请求体。
 */
public class SendConcurrentPaymentsRequest {

    @NotNull(message = "payments 不能为空")
    @Size(min = 2, max = 256, message = "payments 需要 2~256 笔（受 nonceKey 范围限制）")
    private List<@Valid PaymentItem> payments;

    /**
     * 起始 nonceKey，不传时使用 batch.default-start-key（默认 1，保留 0 给顺序交易）
     */
    @Min(value = 0, message = "startNonceKey 不能小于 0")
    @Max(value = 255, message = "startNonceKey 不能大于 255")
    private Integer startNonceKey;

    /**
     * 是否等待全部确认，默认 true
     */
    private Boolean waitForConfirmation;

    public List<PaymentItem> getPayments() {
        return payments;
    }

    public void setPayments(List<PaymentItem> payments) {
        this.payments = payments;
    }

    public Integer getStartNonceKey() {
        return startNonceKey;
    }

    public void setStartNonceKey(Integer startNonceKey) {
        this.startNonceKey = startNonceKey;
    }

    public Boolean getWaitForConfirmation() {
        return waitForConfirmation;
    }

    public void setWaitForConfirmation(Boolean waitForConfirmation) {
        this.waitForConfirmation = waitForConfirmation;
    }
}
