package com.work.batch.core.chain;

/**
 * 最小 receipt 表达：只保留确认阶段需要的字段。
 */
public class InclusionReceipt {

    private final String txHash;
    private final long blockNumber;
    private final String blockHash;
    private final boolean success;

    public InclusionReceipt(String txHash, long blockNumber, String blockHash, boolean success) {
        this.txHash = txHash;
        this.blockNumber = blockNumber;
        this.blockHash = blockHash;
        this.success = success;
    }

    public String getTxHash() {
        return txHash;
    }

    public long getBlockNumber() {
        return blockNumber;
    }

    public String getBlockHash() {
        return blockHash;
    }

    public boolean isSuccess() {
        return success;
    }
}
