package com.example.blockalert.config;

import com.example.blockalert.util.Constants.ResetPolicy;
import com.example.blockalert.util.Constants.ResponsePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "block-alert")
@Data
@Validated
public class AppProperties {

    @Valid
    private Pod pod = new Pod();
    @Valid
    private Sse sse = new Sse();
    @Valid
    private Alert alert = new Alert();
    @Valid
    private Entitlement entitlement = new Entitlement();
    @Valid
    private Plates plates = new Plates();
    @Valid
    private Delivery delivery = new Delivery();
    @Valid
    private Acknowledgment acknowledgment = new Acknowledgment();
    @Valid
    private Connectivity connectivity = new Connectivity();
    @Valid
    private Kafka kafka = new Kafka();

    @Data
    public static class Pod {
        @NotBlank
        private String id = "pod-local";
    }

    @Data
    public static class Sse {
        @NotNull
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        @NotNull
        private Duration staleSessionThreshold = Duration.ofMinutes(2);
    }

    @Data
    public static class Alert {
        @Positive
        private int maxMessageLength = 280;
        @NotNull
        private ResponsePolicy responsePolicy = ResponsePolicy.LAST_WRITE_WINS;
    }

    /**
     * The only place the alert quotas are defined. Premium and lifetime share the high cap.
     */
    @Data
    public static class Entitlement {
        @Positive
        private int freeDailyQuota = 3;
        @Positive
        private int premiumDailyQuota = 200;
        @NotNull
        private ResetPolicy resetPolicy = ResetPolicy.ROLLING_24H;
        @NotNull
        private ZoneId zone = ZoneId.of("UTC");
        @NotNull
        private Duration snapshotRefreshInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Plates {
        @Positive
        private int freeMaxPlates = 3;
        @Positive
        private int premiumMaxPlates = 10;
    }

    @Data
    public static class Delivery {
        @NotNull
        private Duration freshnessWindow = Duration.ofMinutes(5);
    }

    @Data
    public static class Acknowledgment {
        @NotNull
        private Duration timeout = Duration.ofMinutes(10);
        @NotNull
        private Duration reconcileInterval = Duration.ofSeconds(60);
        @NotNull
        private Duration backfillHorizon = Duration.ofHours(24);
    }

    @Data
    public static class Connectivity {
        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(5);
        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(60);
        @NotNull
        private Duration probeInterval = Duration.ofSeconds(15);
    }

    @Data
    public static class Kafka {
        @NotBlank
        private String topic = "alert-changes";
        @Positive
        private int partitions = 10;
        @Positive
        private short replicationFactor = 1;
        @Positive
        private int outboxBatchSize = 100;
    }
}
