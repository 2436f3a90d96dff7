package com.example.consult.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    private String podName;

    private final Room room = new Room();
    private final Identity identity = new Identity();
    private final Session session = new Session();
    private final Relay relay = new Relay();
    private final Status status = new Status();
    private final Cache cache = new Cache();

    @Data
    public static class Room {
        // HMAC key for room identifiers; rotating it invalidates every issued room id
        @NotBlank
        private String secret = "change-me-consult-room-secret";
        @Positive
        private int signatureLength = 16;
    }

    @Data
    public static class Identity {
        @NotBlank
        private String userIdHeader = "X-User-Id";
        @NotBlank
        private String roleHeader = "X-User-Role";
    }

    @Data
    public static class Session {
        @NotNull
        private Duration patientGraceWindow = Duration.ofMinutes(5);
        @NotNull
        private Duration patientNoShowTimeout = Duration.ofMinutes(15);
        @NotNull
        private Duration doctorNoShowTimeout = Duration.ofMinutes(10);
        @Positive
        private long watchdogIntervalMs = 30000L;
        @Positive
        private int watchdogBatchSize = 200;
    }

    @Data
    public static class Relay {
        @Positive
        private long heartbeatInterval = 15000L;
    }

    @Data
    public static class Status {
        @Positive
        private long pollIntervalMs = 3000L;
    }

    @Data
    public static class Cache {
        private final Appointments appointments = new Appointments();

        @Data
        public static class Appointments {
            @Positive
            private long maximumSize = 10000;
            @NotNull
            private Duration expireAfterWrite = Duration.ofMinutes(5);
        }
    }
}
