package com.work.batch.tool.web.dto;

public class NonceKeyView {

    private int nonceKey;
    private String currentNonce;
    private String transactionsExecuted;

    public NonceKeyView() {
    }

    public NonceKeyView(int nonceKey, String currentNonce, String transactionsExecuted) {
        this.nonceKey = nonceKey;
        this.currentNonce = currentNonce;
        this.transactionsExecuted = transactionsExecuted;
    }

    public int getNonceKey() {
        return nonceKey;
    }

    public void setNonceKey(int nonceKey) {
        this.nonceKey = nonceKey;
    }

    public String getCurrentNonce() {
        return currentNonce;
    }

    public void setCurrentNonce(String currentNonce) {
        this.currentNonce = currentNonce;
    }

    public String getTransactionsExecuted() {
        return transactionsExecuted;
    }

    public void setTransactionsExecuted(String transactionsExecuted) {
        this.transactionsExecuted = transactionsExecuted;
    }
}
