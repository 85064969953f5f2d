package com.work.batch.tool.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 仅存在于宿主侧，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.batch.core.config.BatchConfig}。
 */
@ConfigurationProperties(prefix = "batch")
public class BatchProperties {

    /**
     * 每个 chunk 最多并发提交多少笔
     */
    private int chunkSize = 50;

    /**
     * chunk 之间的间隔
     */
    private Duration interChunkDelay = Duration.ofMillis(500);

    /**
     * 扫描活跃 nonceKey 时每组并发数
     */
    private int scanBatchSize = 32;

    /**
     * 未指定 startNonceKey 时的默认值（保留 0 给普通顺序交易）
     */
    private int defaultStartKey = 1;

    /**
     * fan-out 线程数，<=0 表示与 chunkSize 相同
     */
    private int workerThreads = 0;

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public Duration getInterChunkDelay() {
        return interChunkDelay;
    }

    public void setInterChunkDelay(Duration interChunkDelay) {
        this.interChunkDelay = interChunkDelay;
    }

    public int getScanBatchSize() {
        return scanBatchSize;
    }

    public void setScanBatchSize(int scanBatchSize) {
        this.scanBatchSize = scanBatchSize;
    }

    public int getDefaultStartKey() {
        return defaultStartKey;
    }

    public void setDefaultStartKey(int defaultStartKey) {
        this.defaultStartKey = defaultStartKey;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public int effectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Math.max(1, chunkSize);
    }
}
