package com.decisionledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DecisionLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DecisionLedgerApplication.class, args);
    }
}
