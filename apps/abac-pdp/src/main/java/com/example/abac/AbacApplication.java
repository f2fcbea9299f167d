package com.example.abac;

import com.example.abac.config.AbacProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(AbacProperties.class)
public class AbacApplication {

    public static void main(String[] args) {
        SpringApplication.run(AbacApplication.class, args);
    }
}
