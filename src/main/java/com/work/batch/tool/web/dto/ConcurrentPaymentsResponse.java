package com.work.batch.tool.web.dto;

import java.util.List;

/**
 * send_concurrent_payments 返回体：部分失败时 success=false，但已成功的交易仍完整返回。
 */
public class ConcurrentPaymentsResponse {

    private boolean success;
    private int totalPayments;
    private int confirmedPayments;
    private int failedPayments;
    private int pendingPayments;
    private List<ConcurrentTransactionView> transactions;
    private String totalAmount;
    private String totalDuration;
    private int chunksProcessed;
    private String timestamp;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public int getTotalPayments() {
        return totalPayments;
    }

    public void setTotalPayments(int totalPayments) {
        this.totalPayments = totalPayments;
    }

    public int getConfirmedPayments() {
        return confirmedPayments;
    }

    public void setConfirmedPayments(int confirmedPayments) {
        this.confirmedPayments = confirmedPayments;
    }

    public int getFailedPayments() {
        return failedPayments;
    }

    public void setFailedPayments(int failedPayments) {
        this.failedPayments = failedPayments;
    }

    public int getPendingPayments() {
        return pendingPayments;
    }

    public void setPendingPayments(int pendingPayments) {
        this.pendingPayments = pendingPayments;
    }

    public List<ConcurrentTransactionView> getTransactions() {
        return transactions;
    }

    public void setTransactions(List<ConcurrentTransactionView> transactions) {
        this.transactions = transactions;
    }

    public String getTotalAmount() {
        return totalAmount;
    }

    public void setTotalAmount(String totalAmount) {
        this.totalAmount = totalAmount;
    }

    public String getTotalDuration() {
        return totalDuration;
    }

    public void setTotalDuration(String totalDuration) {
        this.totalDuration = totalDuration;
    }

    public int getChunksProcessed() {
        return chunksProcessed;
    }

    public void setChunksProcessed(int chunksProcessed) {
        this.chunksProcessed = chunksProcessed;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }
}
