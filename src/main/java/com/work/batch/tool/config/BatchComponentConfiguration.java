package com.work.batch.tool.config;

import com.work.batch.core.batch.BatchCoordinator;
import com.work.batch.core.batch.ChunkPlanner;
import com.work.batch.core.batch.ConfirmationWaiter;
import com.work.batch.core.batch.ParallelSubmitter;
import com.work.batch.core.chain.ChainClient;
import com.work.batch.core.config.BatchConfig;
import com.work.batch.core.encoding.TransferPayloadEncoder;
import com.work.batch.core.execution.FanOutExecutors;
import com.work.batch.core.nonce.NonceKeyAllocator;
import com.work.batch.tool.chain.MockChainClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * 将 core 组件装配为 Spring Bean：core 只有普通构造函数，所有协作者在这里显式注入，
 * 不存在全局单例。测试需要新实例时直接 new 一套即可。
 */
@Configuration
@EnableConfigurationProperties({BatchProperties.class, ChainProperties.class, TokenProperties.class})
public class BatchComponentConfiguration {

    /**
     * 默认使用 mock；若设置 chain.mode=web3j，将由 Web3jConfiguration 提供实现。
     * 返回具体类型，使其同时可按 ChainClient 与 TokenMetadataClient 注入。
     * 配置的代币别名按 tokens.decimals 预先登记到内存链上。
     */
    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public MockChainClient chainClient(ChainProperties properties, TokenProperties tokenProperties) {
        properties.validate();
        MockChainClient client = new MockChainClient(properties.getAccountAddress(), properties.getMockReceiptDelay());
        for (String tokenAddress : tokenProperties.getAliases().values()) {
            client.registerToken(tokenAddress, tokenProperties.getDecimals());
        }
        return client;
    }

    @Bean
    public BatchConfig batchConfig(BatchProperties properties) {
        return new BatchConfig(
                properties.getChunkSize(),
                properties.getInterChunkDelay(),
                properties.getScanBatchSize()
        );
    }

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolExecutor batchFanOutExecutor(BatchProperties properties) {
        return FanOutExecutors.newFanOutExecutor(properties.effectiveWorkerThreads(), "batch-io-");
    }

    @Bean
    public TransferPayloadEncoder transferPayloadEncoder() {
        return new TransferPayloadEncoder();
    }

    @Bean
    public NonceKeyAllocator nonceKeyAllocator(ChainClient chainClient,
                                               ThreadPoolExecutor batchFanOutExecutor,
                                               BatchConfig batchConfig) {
        return new NonceKeyAllocator(chainClient, batchFanOutExecutor, batchConfig.getScanBatchSize());
    }

    @Bean
    public BatchCoordinator batchCoordinator(ChainClient chainClient,
                                             NonceKeyAllocator nonceKeyAllocator,
                                             TransferPayloadEncoder transferPayloadEncoder,
                                             ThreadPoolExecutor batchFanOutExecutor,
                                             BatchConfig batchConfig) {
        return new BatchCoordinator(
                nonceKeyAllocator,
                new ChunkPlanner(batchConfig),
                new ParallelSubmitter(chainClient, nonceKeyAllocator, transferPayloadEncoder, batchFanOutExecutor),
                new ConfirmationWaiter(chainClient, batchFanOutExecutor)
        );
    }
}
