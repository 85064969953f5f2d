package com.work.batch.core.model;

/**
 * 单笔交易在一次批量请求内的状态。
 */
public enum SubmissionStatus {
    /**
     * 已被节点接受，尚未确认（未等待确认时的最终状态）。
     */
    PENDING,
    /**
     * 已打包且执行成功。
     */
    CONFIRMED,
    /**
     * 提交失败、确认超时或回滚。
     */
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
