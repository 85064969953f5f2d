package com.work.batch.tool.chain;

/**
 * 代币元数据读取（宿主侧能力，core 不依赖）。
 */
public interface TokenMetadataClient {

    /**
     * 读取 TIP-20 代币的 decimals()。读取失败时抛出 BatchException，由调用方决定是否回退到默认精度。
     */
    int decimals(String tokenAddress);
}
