package com.work.batch.tool.chain.web3j;

import com.work.batch.core.chain.ChainClient;
import com.work.batch.core.chain.InclusionReceipt;
import com.work.batch.core.exception.ChainNetworkException;
import com.work.batch.core.exception.ConfirmationTimeoutException;
import com.work.batch.core.exception.TransactionRejectedException;
import com.work.batch.core.exception.TransactionRevertedException;
import com.work.batch.tool.chain.TokenMetadataClient;
import com.work.batch.tool.config.ChainProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint64;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 Web3j 的链客户端实现：
 * - nonceKey 0：eth_getTransactionCount(pending)
 * - nonceKey 1~255：eth_call nonce precompile 的 getNonce(address,uint256)
 * - 发送：eth_sendTransaction，参数中附带 nonce 与 nonceKey（账户由节点托管签名）
 * - 确认：轮询 eth_getTransactionReceipt，直到拿到回执并满足确认数或超时
 * - 代币精度：eth_call decimals()
 *
 * 读超时映射为 RPC_TIMEOUT，其余 IO 错误映射为 RPC_REQUEST_FAILED，二者都可重试。
 */
public class Web3jChainClient implements ChainClient, TokenMetadataClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jChainClient.class);

    private final Web3j web3j;
    private final Web3jService service;
    private final ChainProperties props;

    public Web3jChainClient(Web3j web3j, Web3jService service, ChainProperties props) {
        this.web3j = web3j;
        this.service = service;
        this.props = props;
    }

    @Override
    public String getAddress() {
        return props.getAccountAddress();
    }

    @Override
    public BigInteger resolveSlotCounter(String address, int slot) {
        try {
            if (slot == 0) {
                EthGetTransactionCount resp = web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).send();
                requireNoError(resp, "eth_getTransactionCount");
                return resp.getTransactionCount();
            }
            Function getNonce = new Function("getNonce",
                    Arrays.<Type>asList(new Address(address), new Uint256(BigInteger.valueOf(slot))),
                    Collections.<TypeReference<?>>singletonList(new TypeReference<Uint64>() {
                    }));
            Transaction call = Transaction.createEthCallTransaction(address, props.getNoncePrecompileAddress(),
                    FunctionEncoder.encode(getNonce));
            EthCall resp = web3j.ethCall(call, DefaultBlockParameterName.PENDING).send();
            requireNoError(resp, "eth_call getNonce");
            List<Type> decoded = FunctionReturnDecoder.decode(resp.getValue(), getNonce.getOutputParameters());
            if (decoded.isEmpty()) {
                return BigInteger.ZERO;
            }
            return (BigInteger) decoded.get(0).getValue();
        } catch (IOException e) {
            log.warn("Web3j resolveSlotCounter failed. address={} nonceKey={} err={}", address, slot, e.getMessage());
            throw rpcFailure("Failed to read nonce for key " + slot, e);
        }
    }

    @Override
    public String submit(String to, byte[] payload, BigInteger nonce, int nonceKey) {
        Map<String, String> tx = new LinkedHashMap<>();
        tx.put("from", props.getAccountAddress());
        tx.put("to", to);
        tx.put("data", Numeric.toHexString(payload));
        tx.put("value", "0x0");
        tx.put("nonce", Numeric.encodeQuantity(nonce));
        tx.put("nonceKey", Numeric.encodeQuantity(BigInteger.valueOf(nonceKey)));
        if (props.getFeeToken() != null && !props.getFeeToken().trim().isEmpty()) {
            tx.put("feeToken", props.getFeeToken());
        }
        Request<Map<String, String>, EthSendTransaction> request = new Request<>(
                "eth_sendTransaction", Collections.singletonList(tx), service, EthSendTransaction.class);
        try {
            EthSendTransaction resp = request.send();
            if (resp.hasError()) {
                throw TransactionRejectedException.fromNodeMessage(resp.getError().getMessage());
            }
            return resp.getTransactionHash();
        } catch (IOException e) {
            throw rpcFailure("eth_sendTransaction failed", e);
        }
    }

    @Override
    public InclusionReceipt awaitInclusion(String txHash) {
        Duration timeout = props.getConfirmationTimeout();
        long pollMs = Math.max(1L, props.getReceiptPollInterval().toMillis());
        int attempts = (int) Math.max(1L, timeout.toMillis() / pollMs);
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        TransactionReceiptProcessor processor = new PollingTransactionReceiptProcessor(web3j, pollMs, attempts);
        TransactionReceipt receipt;
        try {
            receipt = processor.waitForTransactionReceipt(txHash);
        } catch (TransactionException e) {
            throw new ConfirmationTimeoutException(txHash, timeout);
        } catch (IOException e) {
            throw rpcFailure("eth_getTransactionReceipt failed", e);
        }
        if (!receipt.isStatusOK()) {
            throw new TransactionRevertedException(txHash, receipt.getRevertReason());
        }
        awaitConfirmations(txHash, receipt.getBlockNumber(), deadline, pollMs);
        return new InclusionReceipt(txHash, receipt.getBlockNumber().longValue(), receipt.getBlockHash(), true);
    }

    /**
     * confirmations = latest - receiptBlock + 1
     */
    private void awaitConfirmations(String txHash, BigInteger receiptBlock, long deadline, long pollMs) {
        int required = props.getConfirmations();
        if (required <= 1) {
            return;
        }
        try {
            while (true) {
                EthBlockNumber latest = web3j.ethBlockNumber().send();
                requireNoError(latest, "eth_blockNumber");
                long confirmations = latest.getBlockNumber().subtract(receiptBlock).longValue() + 1L;
                if (confirmations >= required) {
                    return;
                }
                if (System.currentTimeMillis() + pollMs > deadline) {
                    throw new ConfirmationTimeoutException(txHash, props.getConfirmationTimeout());
                }
                Thread.sleep(pollMs);
            }
        } catch (IOException e) {
            throw rpcFailure("eth_blockNumber failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfirmationTimeoutException(txHash, props.getConfirmationTimeout());
        }
    }

    @Override
    public int decimals(String tokenAddress) {
        Function decimals = new Function("decimals", Collections.<Type>emptyList(),
                Collections.<TypeReference<?>>singletonList(new TypeReference<Uint8>() {
                }));
        Transaction call = Transaction.createEthCallTransaction(props.getAccountAddress(), tokenAddress,
                FunctionEncoder.encode(decimals));
        try {
            EthCall resp = web3j.ethCall(call, DefaultBlockParameterName.LATEST).send();
            requireNoError(resp, "eth_call decimals");
            List<Type> decoded = FunctionReturnDecoder.decode(resp.getValue(), decimals.getOutputParameters());
            if (decoded.isEmpty()) {
                throw new ChainNetworkException("decimals() returned no data for " + tokenAddress);
            }
            return ((BigInteger) decoded.get(0).getValue()).intValue();
        } catch (IOException e) {
            throw rpcFailure("Failed to read decimals of " + tokenAddress, e);
        }
    }

    private static ChainNetworkException rpcFailure(String what, IOException e) {
        if (e instanceof SocketTimeoutException) {
            return ChainNetworkException.timeout(what + ": " + e.getMessage(), e);
        }
        return new ChainNetworkException(what + ": " + e.getMessage(), e);
    }

    private static void requireNoError(Response<?> resp, String method) {
        if (resp.hasError()) {
            throw new ChainNetworkException(method + " returned error: " + resp.getError().getMessage());
        }
    }
}
