package com.riskmgmt.quant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QuantRiskEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuantRiskEngineApplication.class, args);
    }
}
