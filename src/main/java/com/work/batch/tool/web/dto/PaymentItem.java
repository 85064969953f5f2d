package com.work.batch.tool.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Pattern;
import javax.validation.constraints.Size;

/**
 * 单笔转账入参：token 可以是地址或别名，amount 为人类可读的十进制金额。
 */
public class PaymentItem {

    @NotBlank(message = "token 不能为空")
    private String token;

    @NotBlank(message = "to 不能为空")
    @Pattern(regexp = "^0x[a-fA-F0-9]{40}$", message = "Invalid address format")
    private String to;

    @NotBlank(message = "amount 不能为空")
    private String amount;

    /**
     * 可选，最多 32 个字符，会被补齐为 32 字节
     */
    @Size(max = 32, message = "memo 最多 32 个字符")
    private String memo;

    public PaymentItem() {
    }

    public PaymentItem(String token, String to, String amount, String memo) {
        this.token = token;
        this.to = to;
        this.amount = amount;
        this.memo = memo;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public String getAmount() {
        return amount;
    }

    public void setAmount(String amount) {
        this.amount = amount;
    }

    public String getMemo() {
        return memo;
    }

    public void setMemo(String memo) {
        this.memo = memo;
    }
}
