package com.work.batch.core.config;

import java.time.Duration;

import static com.work.batch.core.support.ValidationUtils.requireNonNegative;
import static com.work.batch.core.support.ValidationUtils.requirePositive;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与业务、框架解耦。
 */
public class BatchConfig {

    public static final int DEFAULT_CHUNK_SIZE = 50;
    public static final Duration DEFAULT_INTER_CHUNK_DELAY = Duration.ofMillis(500);
    public static final int DEFAULT_SCAN_BATCH_SIZE = 32;

    /**
     * 单个 chunk 最多并发提交的交易数。
     */
    private final int chunkSize;

    /**
     * chunk 之间的间隔，保护 RPC 节点不被突发请求打满。
     */
    private final Duration interChunkDelay;

    /**
     * listActiveSlots 扫描时每组并发查询的 slot 数。
     */
    private final int scanBatchSize;

    public BatchConfig(int chunkSize, Duration interChunkDelay, int scanBatchSize) {
        this.chunkSize = requirePositive(chunkSize, "chunkSize");
        this.interChunkDelay = requireNonNegative(interChunkDelay, "interChunkDelay");
        this.scanBatchSize = requirePositive(scanBatchSize, "scanBatchSize");
    }

    public static BatchConfig defaultConfig() {
        return new BatchConfig(DEFAULT_CHUNK_SIZE, DEFAULT_INTER_CHUNK_DELAY, DEFAULT_SCAN_BATCH_SIZE);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public Duration getInterChunkDelay() {
        return interChunkDelay;
    }

    public int getScanBatchSize() {
        return scanBatchSize;
    }
}
