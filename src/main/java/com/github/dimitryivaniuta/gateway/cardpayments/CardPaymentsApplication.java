package com.github.dimitryivaniuta.gateway.cardpayments;

import com.github.dimitryivaniuta.gateway.cardpayments.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Application entry point for the Card Payments API.
 */
@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class CardPaymentsApplication {

    /**
     * Bootstraps the Spring Boot application.
     *
     * @param args CLI args
     */
    public static void main(String[] args) {
        SpringApplication.run(CardPaymentsApplication.class, args);
    }
}
