package com.kmg.receipts;

import com.kmg.receipts.config.ReceiptsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ReceiptsProperties.class)
public class ReceiptsApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReceiptsApplication.class, args);
    }
}
