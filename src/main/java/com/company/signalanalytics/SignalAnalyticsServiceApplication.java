package com.company.signalanalytics;

import com.company.signalanalytics.config.SignalAnalyticsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(SignalAnalyticsProperties.class)
public class SignalAnalyticsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(SignalAnalyticsServiceApplication.class, args);
    }
}
