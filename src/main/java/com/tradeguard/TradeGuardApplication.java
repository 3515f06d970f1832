package com.tradeguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TradeGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeGuardApplication.class, args);
    }
}
