package com.work.batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot 启动入口，运行后即可通过 REST 工具接口发起并发批量转账。
 */
@SpringBootApplication
public class BatchPaymentApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatchPaymentApplication.class, args);
    }
}
