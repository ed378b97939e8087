package com.khaounen.contextauth.security.geo;

/**
 * Best-effort reverse geocoding. Never throws; answers {@link #UNKNOWN} when a
 * name cannot be found.
 */
@FunctionalInterface
public interface GeolocationResolver {

    String UNKNOWN = "Unknown";

    String resolve(double lat, double lon);
}
