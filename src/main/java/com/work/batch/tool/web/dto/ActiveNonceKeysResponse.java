package com.work.batch.tool.web.dto;

import java.util.List;

public class ActiveNonceKeysResponse {

    private String address;
    private List<NonceKeyView> activeKeys;
    private int totalActiveKeys;

    public ActiveNonceKeysResponse() {
    }

    public ActiveNonceKeysResponse(String address, List<NonceKeyView> activeKeys) {
        this.address = address;
        this.activeKeys = activeKeys;
        this.totalActiveKeys = activeKeys.size();
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public List<NonceKeyView> getActiveKeys() {
        return activeKeys;
    }

    public void setActiveKeys(List<NonceKeyView> activeKeys) {
        this.activeKeys = activeKeys;
    }

    public int getTotalActiveKeys() {
        return totalActiveKeys;
    }

    public void setTotalActiveKeys(int totalActiveKeys) {
        this.totalActiveKeys = totalActiveKeys;
    }
}
