package com.work.batch.core.batch;

import com.work.batch.core.chain.ChainClient;
import com.work.batch.core.encoding.TransferPayloadEncoder;
import com.work.batch.core.execution.FanOutExecutors;
import com.work.batch.core.model.SubmissionOutcome;
import com.work.batch.core.model.TransferOperation;
import com.work.batch.core.nonce.NonceKeyAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.work.batch.core.support.ValidationUtils.requireNonNull;

/**
 * 单个 chunk 的并发提交：
 * 1. 每笔一个任务并发读取 nonce，全部返回后再进入下一步（每个 chunk 都重新读取）
 * 2. 每笔独立地 编码 -> 附加 nonce/nonceKey -> 提交
 * 3. 任一笔的失败只影响它自己，转为 FAILED 结果，不取消也不阻塞同 chunk 的其他任务
 *
 * fan-out 宽度即 chunk 大小，这里不再做额外限流。
 */
public class ParallelSubmitter {

    private static final Logger log = LoggerFactory.getLogger(ParallelSubmitter.class);

    private final ChainClient chain;
    private final NonceKeyAllocator allocator;
    private final TransferPayloadEncoder encoder;
    private final Executor executor;

    public ParallelSubmitter(ChainClient chain,
                             NonceKeyAllocator allocator,
                             TransferPayloadEncoder encoder,
                             Executor executor) {
        this.chain = requireNonNull(chain, "chain");
        this.allocator = requireNonNull(allocator, "allocator");
        this.encoder = requireNonNull(encoder, "encoder");
        this.executor = requireNonNull(executor, "executor");
    }

    /**
     * @param operations 本 chunk 的操作，第 i 笔使用 nonceKey = baseKey + i
     * @return 与 operations 等长、同序的结果，状态只会是 PENDING 或 FAILED
     */
    public List<SubmissionOutcome> submitChunk(List<TransferOperation> operations, int baseKey) {
        requireNonNull(operations, "operations");
        String account = chain.getAddress();

        List<CompletableFuture<NonceLookup>> lookups = new ArrayList<>(operations.size());
        for (int i = 0; i < operations.size(); i++) {
            final int nonceKey = baseKey + i;
            lookups.add(FanOutExecutors
                    .supply(() -> allocator.resolveNonce(account, nonceKey), executor)
                    .handle((nonce, err) -> err == null
                            ? NonceLookup.ok(nonce)
                            : NonceLookup.failed(FanOutExecutors.describe(err))));
        }
        List<NonceLookup> nonces = FanOutExecutors.joinAll(lookups);

        List<CompletableFuture<SubmissionOutcome>> submissions = new ArrayList<>(operations.size());
        for (int i = 0; i < operations.size(); i++) {
            final int nonceKey = baseKey + i;
            final TransferOperation op = operations.get(i);
            final NonceLookup lookup = nonces.get(i);
            if (lookup.error != null) {
                log.warn("nonce lookup failed nonceKey={} err={}", nonceKey, lookup.error);
                submissions.add(CompletableFuture.completedFuture(
                        SubmissionOutcome.rejected(nonceKey, lookup.error)));
                continue;
            }
            submissions.add(FanOutExecutors
                    .supply(() -> submitOne(op, nonceKey, lookup.nonce), executor)
                    .exceptionally(err -> {
                        String reason = FanOutExecutors.describe(err);
                        log.warn("submit failed nonceKey={} to={} err={}", nonceKey, op.getTo(), reason);
                        return SubmissionOutcome.rejected(nonceKey, reason);
                    }));
        }
        return FanOutExecutors.joinAll(submissions);
    }

    private SubmissionOutcome submitOne(TransferOperation op, int nonceKey, BigInteger nonce) {
        byte[] payload = encoder.encode(op);
        String txHash = chain.submit(op.getToken(), payload, nonce, nonceKey);
        log.debug("submitted nonceKey={} nonce={} txHash={}", nonceKey, nonce, txHash);
        return SubmissionOutcome.submitted(nonceKey, txHash);
    }

    private static final class NonceLookup {
        final BigInteger nonce;
        final String error;

        private NonceLookup(BigInteger nonce, String error) {
            this.nonce = nonce;
            this.error = error;
        }

        static NonceLookup ok(BigInteger nonce) {
            return new NonceLookup(nonce, null);
        }

        static NonceLookup failed(String error) {
            return new NonceLookup(null, error);
        }
    }
}
