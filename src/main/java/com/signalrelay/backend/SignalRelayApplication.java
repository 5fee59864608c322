package com.signalrelay.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan("com.signalrelay.backend.config")
public class SignalRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalRelayApplication.class, args);
    }
}
