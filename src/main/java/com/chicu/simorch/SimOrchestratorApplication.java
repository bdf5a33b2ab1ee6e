package com.chicu.simorch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication(scanBasePackages = "com.chicu.simorch")
@ConfigurationPropertiesScan("com.chicu.simorch")
public class SimOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(SimOrchestratorApplication.class, args);
    }
}
