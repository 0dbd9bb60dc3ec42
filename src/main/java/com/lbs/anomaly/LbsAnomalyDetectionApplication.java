package com.lbs.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LbsAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(LbsAnomalyDetectionApplication.class, args);
    }
}
