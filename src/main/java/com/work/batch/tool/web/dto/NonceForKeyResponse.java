package com.work.batch.tool.web.dto;

public class NonceForKeyResponse {

    private int nonceKey;
    /**
     * uint 计数器，以十进制字符串返回避免精度问题
     */
    private String nonce;
    private String address;

    public NonceForKeyResponse() {
    }

    public NonceForKeyResponse(int nonceKey, String nonce, String address) {
        this.nonceKey = nonceKey;
        this.nonce = nonce;
        this.address = address;
    }

    public int getNonceKey() {
        return nonceKey;
    }

    public void setNonceKey(int nonceKey) {
        this.nonceKey = nonceKey;
    }

    public String getNonce() {
        return nonce;
    }

    public void setNonce(String nonce) {
        this.nonce = nonce;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }
}
