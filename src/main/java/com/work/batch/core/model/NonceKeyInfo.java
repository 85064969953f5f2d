package com.work.batch.core.model;

import java.math.BigInteger;

/**
 * 一个已被使用过的 nonceKey 及其当前计数器值。
 */
public final class NonceKeyInfo {

    private final int key;
    private final BigInteger nonce;

    public NonceKeyInfo(int key, BigInteger nonce) {
        this.key = key;
        this.nonce = nonce;
    }

    public int getKey() {
        return key;
    }

    public BigInteger getNonce() {
        return nonce;
    }
}
