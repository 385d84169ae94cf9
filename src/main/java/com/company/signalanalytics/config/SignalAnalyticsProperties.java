package com.company.signalanalytics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

@Data
@Validated
@ConfigurationProperties(prefix = "signal-analytics")
public class SignalAnalyticsProperties {

    @Valid
    @NotNull
    private Warehouse warehouse = new Warehouse();

    @Valid
    @NotNull
    private Legend legend = new Legend();

    @Valid
    @NotNull
    private Changepoints changepoints = new Changepoints();

    /**
     * Zone the warehouse stores its naive timestamps in. Instants received
     * from clients are converted into it.
     */
    @NotNull
    private ZoneId timezone = ZoneId.of("America/Los_Angeles");

    @Data
    public static class Warehouse {

        @NotBlank
        private String url;

        private String username;

        private String password;

        private String driverClassName;

        private Map<String, String> connectionProperties = new HashMap<>();

        @Min(1)
        private int queryTimeoutSeconds = 300;

        /**
         * How long a request waits for another thread's connection attempt.
         */
        @NotNull
        private Duration connectWaitTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Legend {

        @Min(1)
        private int maxEntities = 10;

        @Min(1)
        private int maxBeforeAfterEntities = 6;

        @Min(1)
        private int maxAnomalyEntities = 6;
    }

    @Data
    public static class Changepoints {

        @DecimalMin("0.0")
        private double defaultImprovement = 0.01;

        @DecimalMin("0.0")
        private double defaultDegradation = 0.01;

        @Min(1)
        private int tableLimit = 100;

        /**
         * Span of raw travel times shown on each side of a changepoint.
         */
        @NotNull
        private Duration detailWindow = Duration.ofDays(7);
    }
}
