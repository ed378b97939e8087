package com.khaounen.contextauth.security.trust;

import com.khaounen.contextauth.security.context.GeoPoint;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * What a user's past logins have taught us. Only {@link ProfileUpdater} produces
 * new instances during normal operation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrustStore {

    @Builder.Default
    Set<String> trustedIps = Set.of();

    @Builder.Default
    Set<String> trustedDevices = Set.of();

    @Builder.Default
    List<GeoPoint> knownLocations = List.of();

    @Builder.Default
    BehavioralBaseline baseline = BehavioralBaseline.empty();

    @Builder.Default
    List<ContextLogEntry> contextLog = List.of();

    int riskScore;

    public static TrustStore empty() {
        return TrustStore.builder().build();
    }

    public boolean isDeviceTrusted(String device) {
        return trustedDevices.contains(device);
    }

    public boolean isIpTrusted(String ip) {
        return trustedIps.contains(ip);
    }
}
