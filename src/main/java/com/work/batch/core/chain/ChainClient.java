package com.work.batch.core.chain;

import java.math.BigInteger;

/**
 * 批量引擎唯一依赖的链交互端口，由宿主应用实现（web3j / mock）。
 *
 * <p>所有方法都可能被多个线程并发调用，实现方需保证线程安全。</p>
 */
public interface ChainClient {

    /**
     * 当前钱包（发送方）地址。
     */
    String getAddress();

    /**
     * 读取 (address, nonceKey) 对应的链上计数器。
     *
     * <ul>
     *   <li>slot 0：账户标准 nonce（eth_getTransactionCount, pending）</li>
     *   <li>slot 1~255：链侧 nonce precompile</li>
     * </ul>
     *
     * @throws com.work.batch.core.exception.ChainNetworkException RPC 失败
     */
    BigInteger resolveSlotCounter(String address, int slot);

    /**
     * 以指定 nonce + nonceKey 发送交易，返回 txHash。
     *
     * @throws com.work.batch.core.exception.BatchException 节点拒绝（原因保留在 message）
     */
    String submit(String to, byte[] payload, BigInteger nonce, int nonceKey);

    /**
     * 阻塞等待交易被打包。
     *
     * @throws com.work.batch.core.exception.ConfirmationTimeoutException 超时
     * @throws com.work.batch.core.exception.TransactionRevertedException 回执 status 为失败
     */
    InclusionReceipt awaitInclusion(String txHash);
}
