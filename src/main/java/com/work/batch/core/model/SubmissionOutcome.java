package com.work.batch.core.model;

import java.util.Objects;

/**
 * 单笔交易的执行结果。
 *
 * 注意：
 * 1. 对象不可变，状态推进（PENDING -> CONFIRMED/FAILED）通过返回新实例完成
 * 2. 终态（CONFIRMED/FAILED）不允许再推进
 * 3. 每个并发任务只写自己的结果槽位，不需要加锁
 */
public final class SubmissionOutcome {

    private final int nonceKey;
    private final String txHash;
    private final SubmissionStatus status;
    private final String error;

    private SubmissionOutcome(int nonceKey, String txHash, SubmissionStatus status, String error) {
        this.nonceKey = nonceKey;
        this.txHash = txHash;
        this.status = Objects.requireNonNull(status, "status");
        this.error = error;
    }

    public static SubmissionOutcome submitted(int nonceKey, String txHash) {
        if (txHash == null || txHash.trim().isEmpty()) {
            throw new IllegalArgumentException("txHash 不能为空");
        }
        return new SubmissionOutcome(nonceKey, txHash, SubmissionStatus.PENDING, null);
    }

    public static SubmissionOutcome rejected(int nonceKey, String error) {
        return new SubmissionOutcome(nonceKey, null, SubmissionStatus.FAILED, error);
    }

    public SubmissionOutcome confirmed() {
        requirePending();
        return new SubmissionOutcome(nonceKey, txHash, SubmissionStatus.CONFIRMED, null);
    }

    public SubmissionOutcome failed(String reason) {
        requirePending();
        return new SubmissionOutcome(nonceKey, txHash, SubmissionStatus.FAILED, reason);
    }

    private void requirePending() {
        if (status.isTerminal()) {
            throw new IllegalStateException("outcome for nonceKey=" + nonceKey + " is already " + status);
        }
    }

    public int getNonceKey() {
        return nonceKey;
    }

    public String getTxHash() {
        return txHash;
    }

    public SubmissionStatus getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "SubmissionOutcome{nonceKey=" + nonceKey + ", txHash=" + txHash + ", status=" + status
                + (error == null ? "" : ", error=" + error) + "}";
    }
}
