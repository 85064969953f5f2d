package com.work.batch.tool.config;

import com.work.batch.core.exception.BatchErrorCode;
import com.work.batch.core.exception.BatchException;
import com.work.batch.core.support.ValidationUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 链连接配置（宿主侧）。
 *
 * mode=mock: 使用 MockChainClient
 * mode=web3j: 使用 Web3jChainClient
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * JSON-RPC 地址
     */
    private String rpcUrl = "https://rpc.testnet.tempo.xyz";

    /**
     * 区块浏览器地址，用于拼接交易链接
     */
    private String explorerUrl = "https://explore.tempo.xyz";

    /**
     * 发送方账户地址（由节点托管签名，web3j 模式下作为 from）
     */
    private String accountAddress = "0x0000000000000000000000000000000000000001";

    /**
     * nonceKey 1~255 的计数器读取入口（链侧 nonce precompile）
     */
    private String noncePrecompileAddress = "0x4e4F4E4345000000000000000000000000000000";

    /**
     * 交易手续费代币（可选，为空时不附带）
     */
    private String feeToken;

    /**
     * 认为交易已确认所需的区块确认数
     */
    private int confirmations = 1;

    /**
     * 单笔交易等待确认的超时
     */
    private Duration confirmationTimeout = Duration.ofSeconds(30);

    /**
     * receipt 轮询间隔
     */
    private Duration receiptPollInterval = Duration.ofMillis(500);

    /**
     * mock 模式下交易从提交到出回执的延迟
     */
    private Duration mockReceiptDelay = Duration.ofMillis(200);

    /**
     * 装配链客户端前调用，配置错误直接阻止启动。
     */
    public void validate() {
        if (!ValidationUtils.isValidAddress(accountAddress)) {
            throw misconfigured("chain.account-address", accountAddress);
        }
        if (!"web3j".equalsIgnoreCase(mode)) {
            return;
        }
        if (rpcUrl == null || rpcUrl.trim().isEmpty()) {
            throw misconfigured("chain.rpc-url", rpcUrl);
        }
        if (!ValidationUtils.isValidAddress(noncePrecompileAddress)) {
            throw misconfigured("chain.nonce-precompile-address", noncePrecompileAddress);
        }
        if (confirmationTimeout == null || confirmationTimeout.isNegative() || confirmationTimeout.isZero()) {
            throw misconfigured("chain.confirmation-timeout", String.valueOf(confirmationTimeout));
        }
        if (receiptPollInterval == null || receiptPollInterval.isNegative() || receiptPollInterval.isZero()) {
            throw misconfigured("chain.receipt-poll-interval", String.valueOf(receiptPollInterval));
        }
    }

    private static BatchException misconfigured(String key, String value) {
        return new BatchException(BatchErrorCode.CONFIGURATION_ERROR, "Invalid " + key + ": " + value);
    }

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getExplorerUrl() {
        return explorerUrl;
    }

    public void setExplorerUrl(String explorerUrl) {
        this.explorerUrl = explorerUrl;
    }

    public String getAccountAddress() {
        return accountAddress;
    }

    public void setAccountAddress(String accountAddress) {
        this.accountAddress = accountAddress;
    }

    public String getNoncePrecompileAddress() {
        return noncePrecompileAddress;
    }

    public void setNoncePrecompileAddress(String noncePrecompileAddress) {
        this.noncePrecompileAddress = noncePrecompileAddress;
    }

    public String getFeeToken() {
        return feeToken;
    }

    public void setFeeToken(String feeToken) {
        this.feeToken = feeToken;
    }

    public int getConfirmations() {
        return confirmations;
    }

    public void setConfirmations(int confirmations) {
        this.confirmations = confirmations;
    }

    public Duration getConfirmationTimeout() {
        return confirmationTimeout;
    }

    public void setConfirmationTimeout(Duration confirmationTimeout) {
        this.confirmationTimeout = confirmationTimeout;
    }

    public Duration getReceiptPollInterval() {
        return receiptPollInterval;
    }

    public void setReceiptPollInterval(Duration receiptPollInterval) {
        this.receiptPollInterval = receiptPollInterval;
    }

    public Duration getMockReceiptDelay() {
        return mockReceiptDelay;
    }

    public void setMockReceiptDelay(Duration mockReceiptDelay) {
        this.mockReceiptDelay = mockReceiptDelay;
    }
}
