package com.work.batch.core.model;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * 一笔待执行的 TIP-20 转账：token 合约地址、收款方、最小单位金额、可选 32 字节 memo。
 *
 * 创建后不可变；引擎只读不写。
 */
public final class TransferOperation {

    public static final int MEMO_LENGTH = 32;

    private final String token;
    private final String to;
    private final BigInteger amount;
    private final byte[] memo;
    private final String tokenSymbol;

    public TransferOperation(String token, String to, BigInteger amount, byte[] memo, String tokenSymbol) {
        if (token == null || token.trim().isEmpty()) {
            throw new IllegalArgumentException("token 不能为空");
        }
        if (to == null || to.trim().isEmpty()) {
            throw new IllegalArgumentException("to 不能为空");
        }
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount 不能为空或负数");
        }
        if (memo != null && memo.length != MEMO_LENGTH) {
            throw new IllegalArgumentException("memo 必须为 32 字节");
        }
        this.token = token;
        this.to = to;
        this.amount = amount;
        this.memo = memo == null ? null : memo.clone();
        this.tokenSymbol = tokenSymbol;
    }

    public TransferOperation(String token, String to, BigInteger amount) {
        this(token, to, amount, null, null);
    }

    public String getToken() {
        return token;
    }

    public String getTo() {
        return to;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public byte[] getMemo() {
        return memo == null ? null : memo.clone();
    }

    public boolean hasMemo() {
        return memo != null;
    }

    public String getTokenSymbol() {
        return tokenSymbol;
    }

    @Override
    public String toString() {
        return "TransferOperation{token=" + token + ", to=" + to + ", amount=" + amount
                + ", memo=" + (memo == null ? "null" : Arrays.toString(memo)) + "}";
    }
}
