package org.nowstart.zonerisk.data.type;

import java.time.Duration;
import java.util.Locale;

public enum Timeframe {
    M5("5m", ZoneTier.MINOR, Duration.ofMinutes(5)),
    M15("15m", ZoneTier.MINOR, Duration.ofMinutes(15)),
    H1("1h", ZoneTier.INTERMEDIATE, Duration.ofHours(1)),
    H4("4h", ZoneTier.INTERMEDIATE, Duration.ofHours(4)),
    D1("1d", ZoneTier.MAJOR, Duration.ofDays(1)),
    W1("1w", ZoneTier.MAJOR, Duration.ofDays(7));

    private final String label;
    private final ZoneTier tier;
    private final Duration duration;

    Timeframe(String label, ZoneTier tier, Duration duration) {
        this.label = label;
        this.tier = tier;
        this.duration = duration;
    }

    public String label() {
        return label;
    }

    public ZoneTier tier() {
        return tier;
    }

    public Duration duration() {
        return duration;
    }

    public static Timeframe fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("timeframe is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Timeframe timeframe : values()) {
            if (timeframe.label.equals(normalized) || timeframe.name().equalsIgnoreCase(normalized)) {
                return timeframe;
            }
        }
        throw new IllegalArgumentException("Unsupported timeframe: " + value);
    }
}
