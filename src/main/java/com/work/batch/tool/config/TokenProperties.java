package com.work.batch.tool.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 代币别名与精度。工具入参里的 token 可以是地址，也可以是这里配置的别名（如 AlphaUSD）。
 */
@ConfigurationProperties(prefix = "tokens")
public class TokenProperties {

    /**
     * 金额换算精度，USD 稳定币默认 6 位
     */
    private int decimals = 6;

    private Map<String, String> aliases = new LinkedHashMap<>();

    public int getDecimals() {
        return decimals;
    }

    public void setDecimals(int decimals) {
        this.decimals = decimals;
    }

    public Map<String, String> getAliases() {
        return aliases;
    }

    public void setAliases(Map<String, String> aliases) {
        this.aliases = aliases;
    }
}
