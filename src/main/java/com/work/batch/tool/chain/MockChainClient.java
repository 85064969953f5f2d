package com.work.batch.tool.chain;

import com.work.batch.core.chain.ChainClient;
import com.work.batch.core.chain.InclusionReceipt;
import com.work.batch.core.exception.BatchErrorCode;
import com.work.batch.core.exception.ChainNetworkException;
import com.work.batch.core.exception.ConfirmationTimeoutException;
import com.work.batch.core.exception.TransactionRejectedException;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存版链客户端，仅用于本地体验与测试，真实环境请使用 web3j 模式。
 *
 * 语义对齐链上行为：
 * - 每个 (address, nonceKey) 一个独立计数器
 * - 提交的 nonce 小于计数器时拒绝（nonce too low），否则计数器前进到 nonce+1
 * - 提交后延迟 receiptDelay 才“出现回执”
 * - 代币精度需先 registerToken，未注册的代币读取 decimals 会失败
 */
public class MockChainClient implements ChainClient, TokenMetadataClient {

    private final String address;
    private final Duration receiptDelay;
    private final Map<String, BigInteger> counters = new ConcurrentHashMap<>();
    private final Map<String, Instant> pendingTxs = new ConcurrentHashMap<>();
    private final AtomicLong blockNumber = new AtomicLong(1);
    private final Map<String, Integer> tokenDecimals = new ConcurrentHashMap<>();

    public MockChainClient(String address, Duration receiptDelay) {
        this.address = address;
        this.receiptDelay = receiptDelay == null ? Duration.ZERO : receiptDelay;
    }

    @Override
    public String getAddress() {
        return address;
    }

    @Override
    public BigInteger resolveSlotCounter(String account, int slot) {
        return counters.getOrDefault(counterKey(account, slot), BigInteger.ZERO);
    }

    @Override
    public String submit(String to, byte[] payload, BigInteger nonce, int nonceKey) {
        String key = counterKey(address, nonceKey);
        // 同一 key 的并发提交需要互斥，compute 保证原子性
        BigInteger[] accepted = new BigInteger[1];
        counters.compute(key, (k, current) -> {
            BigInteger next = current == null ? BigInteger.ZERO : current;
            if (nonce.compareTo(next) < 0) {
                return current;
            }
            accepted[0] = nonce;
            return nonce.add(BigInteger.ONE);
        });
        if (accepted[0] == null) {
            throw new TransactionRejectedException(BatchErrorCode.NONCE_TOO_LOW,
                    "nonce too low: nonceKey=" + nonceKey + " nonce=" + nonce);
        }
        String txHash = Hash.sha3String(address + ":" + nonceKey + ":" + nonce + ":" + to + ":" + Numeric.toHexString(payload));
        pendingTxs.put(txHash, Instant.now());
        return txHash;
    }

    @Override
    public InclusionReceipt awaitInclusion(String txHash) {
        Instant sentAt = pendingTxs.get(txHash);
        if (sentAt == null) {
            throw new ConfirmationTimeoutException(txHash, receiptDelay);
        }
        long waitMs = Duration.between(Instant.now(), sentAt.plus(receiptDelay)).toMillis();
        if (waitMs > 0) {
            try {
                Thread.sleep(waitMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ConfirmationTimeoutException(txHash, receiptDelay);
            }
        }
        pendingTxs.remove(txHash);
        long bn = blockNumber.getAndIncrement();
        return new InclusionReceipt(txHash, bn, "block_" + bn, true);
    }

    public MockChainClient registerToken(String tokenAddress, int decimals) {
        tokenDecimals.put(tokenAddress.toLowerCase(), decimals);
        return this;
    }

    @Override
    public int decimals(String tokenAddress) {
        Integer d = tokenDecimals.get(tokenAddress.toLowerCase());
        if (d == null) {
            throw new ChainNetworkException("decimals() call failed: no contract at " + tokenAddress);
        }
        return d;
    }

    private static String counterKey(String account, int slot) {
        return account.toLowerCase() + "#" + slot;
    }
}
