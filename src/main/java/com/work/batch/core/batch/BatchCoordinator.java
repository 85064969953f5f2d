package com.work.batch.core.batch;

import com.work.batch.core.exception.BatchValidationException;
import com.work.batch.core.model.BatchResult;
import com.work.batch.core.model.NonceKeyInfo;
import com.work.batch.core.model.SubmissionOutcome;
import com.work.batch.core.model.TransferOperation;
import com.work.batch.core.nonce.NonceKeyAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.work.batch.core.support.ValidationUtils.requireNonNull;

/**
 * 门面（Facade）层：批量并发发送的唯一入口。
 *
 * 流程：校验 -> 切 chunk -> 逐个 chunk {读 nonce -> 并发提交 -> 可选并发确认} -> 汇总。
 *
 * <ul>
 *   <li>只有前置校验错误会以异常形式抛出，且一定发生在任何网络调用之前</li>
 *   <li>单笔失败全部收敛到结果里，调用方总能拿到完整的 outcome 列表</li>
 *   <li>chunk 之间严格串行，中间 sleep interChunkDelay（最后一个 chunk 之后不 sleep）</li>
 *   <li>没有请求级幂等：重试需要调用方换一个 startKey，否则可能与上一轮仍在 pending 的交易冲突</li>
 * </ul>
 */
public class BatchCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchCoordinator.class);

    private final NonceKeyAllocator allocator;
    private final ChunkPlanner planner;
    private final ParallelSubmitter submitter;
    private final ConfirmationWaiter waiter;

    public BatchCoordinator(NonceKeyAllocator allocator,
                            ChunkPlanner planner,
                            ParallelSubmitter submitter,
                            ConfirmationWaiter waiter) {
        this.allocator = requireNonNull(allocator, "allocator");
        this.planner = requireNonNull(planner, "planner");
        this.submitter = requireNonNull(submitter, "submitter");
        this.waiter = requireNonNull(waiter, "waiter");
    }

    /**
     * 为每笔操作分配 nonceKey = startKey + index 并并发发送。
     *
     * @throws BatchValidationException 列表为空、startKey 越界、剩余 key 不足
     */
    public BatchResult submitBatch(List<TransferOperation> operations, int startKey, boolean waitForConfirmation) {
        long startNanos = System.nanoTime();
        validate(operations, startKey);

        List<Chunk> chunks = planner.plan(operations.size(), startKey);
        log.info("batch start payments={} startKey={} chunks={} wait={}",
                operations.size(), startKey, chunks.size(), waitForConfirmation);

        List<SubmissionOutcome> outcomes = new ArrayList<>(operations.size());
        int chunksProcessed = 0;
        for (Chunk chunk : chunks) {
            if (chunk.getIndex() > 0 && !pauseBetweenChunks()) {
                failRemaining(outcomes, operations.size(), startKey, "Batch interrupted before chunk " + chunk.getIndex());
                break;
            }
            List<TransferOperation> slice = operations.subList(chunk.getOffset(), chunk.getEnd());
            List<SubmissionOutcome> submitted = submitter.submitChunk(slice, chunk.getBaseKey());
            outcomes.addAll(waiter.awaitAll(submitted, waitForConfirmation));
            chunksProcessed++;
            log.info("chunk done index={} baseKey={} size={}", chunk.getIndex(), chunk.getBaseKey(), chunk.getSize());
        }

        BatchResult result = BatchResult.aggregate(outcomes, Duration.ofNanos(System.nanoTime() - startNanos), chunksProcessed);
        log.info("batch done total={} confirmed={} failed={} pending={} chunks={} durationMs={}",
                result.getTotalPayments(), result.getConfirmedPayments(), result.getFailedPayments(),
                result.getPendingPayments(), result.getChunksProcessed(), result.getDurationMs());
        return result;
    }

    public BigInteger getNonceForKey(int nonceKey, String address) {
        return allocator.resolveNonce(address, nonceKey);
    }

    public List<NonceKeyInfo> listActiveNonceKeys(String address) {
        return allocator.listActiveSlots(address);
    }

    /**
     * 校验顺序固定，先失败者胜出。
     */
    static void validate(List<TransferOperation> operations, int startKey) {
        if (operations == null || operations.isEmpty()) {
            throw BatchValidationException.missingField("payments");
        }
        NonceKeyAllocator.requireNonceKey("startNonceKey", startKey, "Start nonce key must be between 0 and 255");
        int available = NonceKeyAllocator.KEY_SPACE - startKey;
        if (operations.size() > available) {
            throw BatchValidationException.custom("payments",
                    "Cannot send " + operations.size() + " payments starting at key " + startKey + ". "
                            + "Max " + available + " payments available with this start key.",
                    operations.size() + " payments, startKey=" + startKey);
        }
    }

    private boolean pauseBetweenChunks() {
        long delayMs = planner.getInterChunkDelay().toMillis();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("batch interrupted during inter-chunk delay");
            return false;
        }
    }

    private void failRemaining(List<SubmissionOutcome> outcomes, int total, int startKey, String reason) {
        for (int i = outcomes.size(); i < total; i++) {
            outcomes.add(SubmissionOutcome.rejected(startKey + i, reason));
        }
    }
}
