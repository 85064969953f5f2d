package com.work.batch.tool.config;

import com.work.batch.tool.chain.web3j.Web3jChainClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean
    public HttpService web3jHttpService(ChainProperties properties) {
        properties.validate();
        return new HttpService(properties.getRpcUrl());
    }

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(HttpService web3jHttpService) {
        return Web3j.build(web3jHttpService);
    }

    @Bean
    public Web3jChainClient web3jChainClient(Web3j web3j, HttpService web3jHttpService, ChainProperties properties) {
        return new Web3jChainClient(web3j, web3jHttpService, properties);
    }
}
