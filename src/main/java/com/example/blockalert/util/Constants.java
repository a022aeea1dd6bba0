package com.example.blockalert.util;

public final class Constants {

    private Constants() {}

    public static final String DLT_SUFFIX = "-dlt";

    public enum Tier {
        FREE,
        PREMIUM,
        LIFETIME;

        public boolean isPremium() {
            return this != FREE;
        }
    }

    public enum UrgencyLevel {
        LOW,
        NORMAL,
        HIGH;

        public String wireValue() {
            return name().toLowerCase();
        }

        /**
         * Null or blank input means the default level; anything else must name a level.
         */
        public static UrgencyLevel fromWireValue(String value) {
            if (value == null || value.isBlank()) {
                return NORMAL;
            }
            for (UrgencyLevel level : values()) {
                if (level.wireValue().equalsIgnoreCase(value.trim())) {
                    return level;
                }
            }
            throw new IllegalArgumentException("Unknown urgency level: " + value);
        }
    }

    public enum MarkerStatus {
        PENDING,
        TIMED_OUT,
        ACKNOWLEDGED
    }

    public enum ConnectionStatus {
        ACTIVE,
        INACTIVE
    }

    public enum ConnectivityState {
        ONLINE,
        OFFLINE
    }

    public enum ResetPolicy {
        ROLLING_24H,
        CALENDAR_DAY
    }

    public enum ResponsePolicy {
        LAST_WRITE_WINS,
        FIRST_WRITE_WINS
    }

    public enum EventType {
        CREATED,
        READ,
        RESPONDED
    }

    public enum SseEventType {
        CONNECTED,
        ALERT,
        ALERT_UPDATED,
        ALERT_ANSWERED,
        ENTITLEMENT,
        CONNECTIVITY,
        HEARTBEAT,
        SERVER_SHUTDOWN
    }
}
