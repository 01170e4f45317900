package com.hockeyquant.prediction;

import com.hockeyquant.prediction.config.EngineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "com.hockeyquant")
@EnableConfigurationProperties(EngineProperties.class)
@EnableMongoRepositories(basePackages = "com.hockeyquant.adapter.repository")
public class PredictionEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PredictionEngineApplication.class, args);
    }
}
