package com.work.batch.core.batch;

import com.work.batch.core.chain.ChainClient;
import com.work.batch.core.chain.InclusionReceipt;
import com.work.batch.core.execution.FanOutExecutors;
import com.work.batch.core.model.SubmissionOutcome;
import com.work.batch.core.model.SubmissionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.work.batch.core.support.ValidationUtils.requireNonNull;

/**
 * 对已提交的交易并发等待打包。
 *
 * - 只等待 PENDING 且有 txHash 的结果；已失败的原样透传
 * - 打包成功 -> CONFIRMED；超时/回滚/其他错误 -> FAILED（保留错误文本）
 * - 单笔确认失败不影响其他
 */
public class ConfirmationWaiter {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationWaiter.class);

    private final ChainClient chain;
    private final Executor executor;

    public ConfirmationWaiter(ChainClient chain, Executor executor) {
        this.chain = requireNonNull(chain, "chain");
        this.executor = requireNonNull(executor, "executor");
    }

    public List<SubmissionOutcome> awaitAll(List<SubmissionOutcome> submitted, boolean waitForConfirmation) {
        requireNonNull(submitted, "submitted");
        if (!waitForConfirmation) {
            return submitted;
        }
        List<CompletableFuture<SubmissionOutcome>> waits = new ArrayList<>(submitted.size());
        for (SubmissionOutcome outcome : submitted) {
            if (outcome.getStatus() != SubmissionStatus.PENDING || outcome.getTxHash() == null) {
                waits.add(CompletableFuture.completedFuture(outcome));
                continue;
            }
            waits.add(FanOutExecutors
                    .supply(() -> confirm(outcome), executor)
                    .exceptionally(err -> {
                        String reason = FanOutExecutors.describe(err);
                        log.warn("confirmation failed nonceKey={} txHash={} err={}",
                                outcome.getNonceKey(), outcome.getTxHash(), reason);
                        return outcome.failed(reason);
                    }));
        }
        return FanOutExecutors.joinAll(waits);
    }

    private SubmissionOutcome confirm(SubmissionOutcome outcome) {
        InclusionReceipt receipt = chain.awaitInclusion(outcome.getTxHash());
        if (receipt != null && !receipt.isSuccess()) {
            // 兜底：实现方返回了失败回执而不是抛 TransactionRevertedException
            return outcome.failed("Transaction reverted: " + outcome.getTxHash());
        }
        return outcome.confirmed();
    }
}
