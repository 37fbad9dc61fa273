package com.flagship.custodial_exchange;

import com.flagship.custodial_exchange.config.ExchangeProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Custodial exchange: order escrow market and wager lobby engine.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ExchangeProperties.class)
public class CustodialExchangeApplication {

    public static void main(String[] args) {
        SpringApplication.run(CustodialExchangeApplication.class, args);
    }
}
