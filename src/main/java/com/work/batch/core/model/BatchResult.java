package com.work.batch.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次批量请求的汇总结果，构造后不可变。
 *
 * outcomes 顺序与输入顺序一致，第 i 笔使用的 nonceKey = startKey + i。
 */
public final class BatchResult {

    private final boolean success;
    private final int totalPayments;
    private final int confirmedPayments;
    private final int failedPayments;
    private final int pendingPayments;
    private final List<SubmissionOutcome> outcomes;
    private final Duration duration;
    private final int chunksProcessed;

    private BatchResult(List<SubmissionOutcome> outcomes, Duration duration, int chunksProcessed) {
        int confirmed = 0;
        int failed = 0;
        int pending = 0;
        for (SubmissionOutcome o : outcomes) {
            switch (o.getStatus()) {
                case CONFIRMED:
                    confirmed++;
                    break;
                case FAILED:
                    failed++;
                    break;
                default:
                    pending++;
            }
        }
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
        this.totalPayments = this.outcomes.size();
        this.confirmedPayments = confirmed;
        this.failedPayments = failed;
        this.pendingPayments = pending;
        this.success = failed == 0;
        this.duration = duration;
        this.chunksProcessed = chunksProcessed;
    }

    public static BatchResult aggregate(List<SubmissionOutcome> outcomes, Duration duration, int chunksProcessed) {
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes 不能为null");
        }
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration 不能为null或负数");
        }
        return new BatchResult(outcomes, duration, chunksProcessed);
    }

    public boolean isSuccess() {
        return success;
    }

    public int getTotalPayments() {
        return totalPayments;
    }

    public int getConfirmedPayments() {
        return confirmedPayments;
    }

    public int getFailedPayments() {
        return failedPayments;
    }

    public int getPendingPayments() {
        return pendingPayments;
    }

    public List<SubmissionOutcome> getOutcomes() {
        return outcomes;
    }

    public Duration getDuration() {
        return duration;
    }

    public long getDurationMs() {
        return duration.toMillis();
    }

    public int getChunksProcessed() {
        return chunksProcessed;
    }
}
