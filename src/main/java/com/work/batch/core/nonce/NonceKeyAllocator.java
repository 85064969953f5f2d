package com.work.batch.core.nonce;

import com.work.batch.core.chain.ChainClient;
import com.work.batch.core.exception.BatchValidationException;
import com.work.batch.core.execution.FanOutExecutors;
import com.work.batch.core.model.NonceKeyInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static com.work.batch.core.support.ValidationUtils.requireNonNull;
import static com.work.batch.core.support.ValidationUtils.requirePositive;

/**
 * nonceKey -> 链上计数器。
 *
 * 每个账户有 256 个相互独立的 nonce 序列：key 0 是账户标准 nonce，1~255 供并行发送使用。
 * 计数器只存在于链上，这里每次都实时读取，不做任何缓存：上一批提交可能已经推进了计数器，
 * 本地缓存会导致旧 nonce 被重放。
 */
public class NonceKeyAllocator {

    private static final Logger log = LoggerFactory.getLogger(NonceKeyAllocator.class);

    public static final int MIN_KEY = 0;
    public static final int MAX_KEY = 255;
    public static final int KEY_SPACE = MAX_KEY + 1;

    private final ChainClient chain;
    private final Executor executor;
    private final int scanBatchSize;

    public NonceKeyAllocator(ChainClient chain, Executor executor, int scanBatchSize) {
        this.chain = requireNonNull(chain, "chain");
        this.executor = requireNonNull(executor, "executor");
        this.scanBatchSize = requirePositive(scanBatchSize, "scanBatchSize");
    }

    /**
     * 读取指定 slot 的当前计数器：一次 RPC、无副作用，可对不同 slot 并发调用。
     *
     * @param accountAddress 为空时使用钱包地址
     */
    public BigInteger resolveNonce(String accountAddress, int slot) {
        requireNonceKey("nonceKey", slot, "Nonce key must be between 0 and 255");
        String address = resolveAddress(accountAddress);
        BigInteger counter = chain.resolveSlotCounter(address, slot);
        log.debug("resolved nonce address={} nonceKey={} nonce={}", address, slot, counter);
        return counter;
    }

    /**
     * 扫描全部 256 个 slot，返回计数器大于 0 的 key（升序）。
     * 按 scanBatchSize 分组并发，组与组之间串行，避免一次性打满节点。
     */
    public List<NonceKeyInfo> listActiveSlots(String accountAddress) {
        String address = resolveAddress(accountAddress);
        List<NonceKeyInfo> active = new ArrayList<>();
        for (int from = MIN_KEY; from < KEY_SPACE; from += scanBatchSize) {
            int to = Math.min(from + scanBatchSize, KEY_SPACE);
            List<CompletableFuture<NonceKeyInfo>> group = new ArrayList<>(to - from);
            for (int key = from; key < to; key++) {
                final int slot = key;
                group.add(FanOutExecutors.supply(
                        () -> new NonceKeyInfo(slot, resolveNonce(address, slot)), executor));
            }
            // 只读诊断接口：任一 slot 读取失败则整个扫描失败
            for (NonceKeyInfo info : FanOutExecutors.joinAll(group)) {
                if (info.getNonce().signum() > 0) {
                    active.add(info);
                }
            }
        }
        log.info("scanned nonce keys address={} active={}", address, active.size());
        return active;
    }

    private String resolveAddress(String accountAddress) {
        if (accountAddress == null || accountAddress.trim().isEmpty()) {
            return chain.getAddress();
        }
        return accountAddress;
    }

    public static int requireNonceKey(String field, int key, String message) {
        if (key < MIN_KEY || key > MAX_KEY) {
            throw BatchValidationException.custom(field, message, String.valueOf(key));
        }
        return key;
    }
}
