package com.khaounen.contextauth.security.trust;

import com.khaounen.contextauth.security.context.GeoPoint;

import java.time.Instant;

public record ContextLogEntry(
        String ip,
        String device,
        GeoPoint location,
        String locationName,
        Instant timestamp,
        int riskScore
) {
}
