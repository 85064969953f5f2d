package com.work.batch.tool.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

public class ConcurrentTransactionView {

    private int nonceKey;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String transactionHash;
    private String to;
    private String amount;
    private String token;
    private String tokenSymbol;
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String memo;
    private String status;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String error;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String explorerUrl;

    public int getNonceKey() {
        return nonceKey;
    }

    public void setNonceKey(int nonceKey) {
        this.nonceKey = nonceKey;
    }

    public String getTransactionHash() {
        return transactionHash;
    }

    public void setTransactionHash(String transactionHash) {
        this.transactionHash = transactionHash;
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

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getTokenSymbol() {
        return tokenSymbol;
    }

    public void setTokenSymbol(String tokenSymbol) {
        this.tokenSymbol = tokenSymbol;
    }

    public String getMemo() {
        return memo;
    }

    public void setMemo(String memo) {
        this.memo = memo;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getExplorerUrl() {
        return explorerUrl;
    }

    public void setExplorerUrl(String explorerUrl) {
        this.explorerUrl = explorerUrl;
    }
}
