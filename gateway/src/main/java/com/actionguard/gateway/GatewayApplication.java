package com.actionguard.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(GatewayApplication.class, args);
    }

    /**
     * UTC clock for snapshot names, audit timestamps and reports.
     * Tests swap in {@link Clock#fixed} to get predictable names.
     */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
