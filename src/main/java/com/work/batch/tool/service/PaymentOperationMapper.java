package com.work.batch.tool.service;

import com.work.batch.core.exception.BatchErrorCode;
import com.work.batch.core.exception.BatchException;
import com.work.batch.core.exception.BatchValidationException;
import com.work.batch.core.model.TransferOperation;
import com.work.batch.core.support.ValidationUtils;
import com.work.batch.tool.chain.TokenMetadataClient;
import com.work.batch.tool.config.TokenProperties;
import com.work.batch.tool.web.dto.PaymentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 工具入参 -> core 的 TransferOperation：
 * - token：地址原样使用，否则按别名查找（先精确，再忽略大小写）
 * - amount：按链上读到的 token decimals() 换算为最小单位，读取失败时回退到 tokens.decimals；不允许丢精度
 * - memo：UTF-8 字节左补零到 32 字节
 */
public class PaymentOperationMapper {

    private static final Logger log = LoggerFactory.getLogger(PaymentOperationMapper.class);

    private final TokenProperties tokens;
    private final TokenMetadataClient metadata;

    public PaymentOperationMapper(TokenProperties tokens, TokenMetadataClient metadata) {
        this.tokens = tokens;
        this.metadata = metadata;
    }

    /**
     * 同一次调用内，每个代币只读取一次 decimals。
     */
    public List<TransferOperation> toOperations(List<PaymentItem> items) {
        Map<String, Integer> decimalsByToken = new HashMap<>();
        List<TransferOperation> out = new ArrayList<>(items.size());
        for (PaymentItem item : items) {
            String tokenAddress = resolveTokenAddress(item.getToken());
            int decimals = decimalsByToken.computeIfAbsent(tokenAddress.toLowerCase(), k -> resolveDecimals(tokenAddress));
            out.add(toOperation(item, tokenAddress, decimals));
        }
        return out;
    }

    public TransferOperation toOperation(PaymentItem item) {
        String tokenAddress = resolveTokenAddress(item.getToken());
        return toOperation(item, tokenAddress, resolveDecimals(tokenAddress));
    }

    private TransferOperation toOperation(PaymentItem item, String tokenAddress, int decimals) {
        BigInteger amount = parseUnits(item.getAmount(), decimals);
        byte[] memo = item.getMemo() == null || item.getMemo().isEmpty() ? null : padMemo(item.getMemo());
        return new TransferOperation(tokenAddress, item.getTo(), amount, memo, item.getToken());
    }

    public int resolveDecimals(String tokenAddress) {
        try {
            return metadata.decimals(tokenAddress);
        } catch (BatchException e) {
            log.warn("decimals() read failed, fallback to {} token={} err={}", tokens.getDecimals(), tokenAddress, e.getMessage());
            return tokens.getDecimals();
        }
    }

    public String resolveTokenAddress(String token) {
        if (ValidationUtils.isValidAddress(token)) {
            return token;
        }
        Map<String, String> aliases = tokens.getAliases();
        String address = aliases.get(token);
        if (address == null) {
            for (Map.Entry<String, String> e : aliases.entrySet()) {
                if (e.getKey().equalsIgnoreCase(token)) {
                    address = e.getValue();
                    break;
                }
            }
        }
        if (address == null) {
            throw new BatchValidationException(BatchErrorCode.INVALID_TOKEN, "token",
                    "Unknown token: " + token, token,
                    "Use a 0x-prefixed token address or one of " + aliases.keySet());
        }
        return address;
    }

    static BigInteger parseUnits(String amount, int decimals) {
        try {
            BigDecimal value = new BigDecimal(amount.trim());
            if (value.signum() <= 0) {
                throw invalidAmount(amount, "Amount must be greater than 0");
            }
            return value.movePointRight(decimals).toBigIntegerExact();
        } catch (NumberFormatException e) {
            throw invalidAmount(amount, "Invalid amount format");
        } catch (ArithmeticException e) {
            throw invalidAmount(amount, "Amount has more than " + decimals + " decimal places");
        }
    }

    static String formatUnits(BigInteger value, int decimals) {
        BigDecimal d = new BigDecimal(value, decimals);
        if (d.signum() == 0) {
            return "0";
        }
        return d.stripTrailingZeros().toPlainString();
    }

    static byte[] padMemo(String memo) {
        byte[] raw = memo.getBytes(StandardCharsets.UTF_8);
        if (raw.length > TransferOperation.MEMO_LENGTH) {
            throw new BatchValidationException(BatchErrorCode.INVALID_MEMO, "memo",
                    "Memo exceeds 32 bytes", memo, "Shorten the memo to at most 32 bytes");
        }
        byte[] padded = new byte[TransferOperation.MEMO_LENGTH];
        System.arraycopy(raw, 0, padded, padded.length - raw.length, raw.length);
        return padded;
    }

    private static BatchValidationException invalidAmount(String amount, String message) {
        return new BatchValidationException(BatchErrorCode.INVALID_AMOUNT, "amount", message, amount,
                "Use a positive decimal amount such as \"100.50\"");
    }
}
