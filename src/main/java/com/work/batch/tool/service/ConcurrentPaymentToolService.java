package com.work.batch.tool.service;

import com.work.batch.core.batch.BatchCoordinator;
import com.work.batch.core.chain.ChainClient;
import com.work.batch.core.exception.BatchErrorCode;
import com.work.batch.core.exception.BatchValidationException;
import com.work.batch.core.model.BatchResult;
import com.work.batch.core.model.NonceKeyInfo;
import com.work.batch.core.model.SubmissionOutcome;
import com.work.batch.core.model.TransferOperation;
import com.work.batch.core.support.ValidationUtils;
import com.work.batch.tool.chain.TokenMetadataClient;
import com.work.batch.tool.config.BatchProperties;
import com.work.batch.tool.config.ChainProperties;
import com.work.batch.tool.config.TokenProperties;
import com.work.batch.tool.web.dto.ActiveNonceKeysResponse;
import com.work.batch.tool.web.dto.ConcurrentPaymentsResponse;
import com.work.batch.tool.web.dto.ConcurrentTransactionView;
import com.work.batch.tool.web.dto.NonceForKeyResponse;
import com.work.batch.tool.web.dto.NonceKeyView;
import com.work.batch.tool.web.dto.PaymentItem;
import com.work.batch.tool.web.dto.SendConcurrentPaymentsRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 工具层：入参转换 -> BatchCoordinator -> 返回体整形。BatchResult 的计数原样转发。
 */
@Service
public class ConcurrentPaymentToolService {

    private static final Logger log = LoggerFactory.getLogger(ConcurrentPaymentToolService.class);

    /**
     * totalAmount 假定同一种 USD 稳定币，按 6 位精度展示
     */
    private static final int TOTAL_AMOUNT_DECIMALS = 6;

    private final BatchCoordinator coordinator;
    private final ChainClient chainClient;
    private final BatchProperties batchProperties;
    private final ChainProperties chainProperties;
    private final PaymentOperationMapper mapper;

    public ConcurrentPaymentToolService(BatchCoordinator coordinator,
                                        ChainClient chainClient,
                                        BatchProperties batchProperties,
                                        ChainProperties chainProperties,
                                        TokenProperties tokenProperties,
                                        TokenMetadataClient tokenMetadataClient) {
        this.coordinator = coordinator;
        this.chainClient = chainClient;
        this.batchProperties = batchProperties;
        this.chainProperties = chainProperties;
        this.mapper = new PaymentOperationMapper(tokenProperties, tokenMetadataClient);
    }

    public ConcurrentPaymentsResponse sendConcurrentPayments(SendConcurrentPaymentsRequest request) {
        List<PaymentItem> items = request.getPayments();
        int startKey = request.getStartNonceKey() == null
                ? batchProperties.getDefaultStartKey()
                : request.getStartNonceKey();
        boolean wait = request.getWaitForConfirmation() == null || request.getWaitForConfirmation();

        List<TransferOperation> operations = mapper.toOperations(items);
        BigInteger total = BigInteger.ZERO;
        for (TransferOperation op : operations) {
            total = total.add(op.getAmount());
        }

        BatchResult result = coordinator.submitBatch(operations, startKey, wait);
        log.info("send_concurrent_payments done payments={} startKey={} confirmed={} failed={} durationMs={}",
                items.size(), startKey, result.getConfirmedPayments(), result.getFailedPayments(), result.getDurationMs());

        List<ConcurrentTransactionView> views = new ArrayList<>(items.size());
        List<SubmissionOutcome> outcomes = result.getOutcomes();
        for (int i = 0; i < outcomes.size(); i++) {
            views.add(toView(outcomes.get(i), items.get(i), operations.get(i)));
        }

        ConcurrentPaymentsResponse resp = new ConcurrentPaymentsResponse();
        resp.setSuccess(result.isSuccess());
        resp.setTotalPayments(result.getTotalPayments());
        resp.setConfirmedPayments(result.getConfirmedPayments());
        resp.setFailedPayments(result.getFailedPayments());
        resp.setPendingPayments(result.getPendingPayments());
        resp.setTransactions(views);
        resp.setTotalAmount(PaymentOperationMapper.formatUnits(total, TOTAL_AMOUNT_DECIMALS));
        resp.setTotalDuration(result.getDurationMs() + "ms");
        resp.setChunksProcessed(result.getChunksProcessed());
        resp.setTimestamp(Instant.now().toString());
        return resp;
    }

    public NonceForKeyResponse getNonceForKey(int nonceKey, String address) {
        String target = resolveAddress(address);
        BigInteger nonce = coordinator.getNonceForKey(nonceKey, target);
        return new NonceForKeyResponse(nonceKey, nonce.toString(), target);
    }

    public ActiveNonceKeysResponse listActiveNonceKeys(String address) {
        String target = resolveAddress(address);
        List<NonceKeyView> keys = new ArrayList<>();
        for (NonceKeyInfo info : coordinator.listActiveNonceKeys(target)) {
            String n = info.getNonce().toString();
            keys.add(new NonceKeyView(info.getKey(), n, n));
        }
        return new ActiveNonceKeysResponse(target, keys);
    }

    private String resolveAddress(String address) {
        if (address == null || address.trim().isEmpty()) {
            return chainClient.getAddress();
        }
        if (!ValidationUtils.isValidAddress(address)) {
            throw new BatchValidationException(BatchErrorCode.INVALID_ADDRESS, "address",
                    "Invalid address format", address, "Use a 0x-prefixed 40-character hex address");
        }
        return address;
    }

    private ConcurrentTransactionView toView(SubmissionOutcome outcome, PaymentItem item, TransferOperation op) {
        ConcurrentTransactionView v = new ConcurrentTransactionView();
        v.setNonceKey(outcome.getNonceKey());
        v.setTransactionHash(outcome.getTxHash());
        v.setTo(item.getTo());
        v.setAmount(item.getAmount());
        v.setToken(op.getToken());
        v.setTokenSymbol(item.getToken());
        v.setMemo(item.getMemo());
        v.setStatus(outcome.getStatus().name().toLowerCase());
        v.setError(outcome.getError());
        if (outcome.getTxHash() != null) {
            v.setExplorerUrl(buildExplorerTxUrl(chainProperties.getExplorerUrl(), outcome.getTxHash()));
        }
        return v;
    }

    static String buildExplorerTxUrl(String explorerUrl, String txHash) {
        String base = explorerUrl.endsWith("/") ? explorerUrl.substring(0, explorerUrl.length() - 1) : explorerUrl;
        return base + "/tx/" + txHash;
    }
}
