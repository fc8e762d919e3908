package com.example.routing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.example.routing.config.AppConfig;
import com.example.routing.config.RouterProperties;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({AppConfig.class, RouterProperties.class})
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}
