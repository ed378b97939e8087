package com.khaounen.contextauth.security.geo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.khaounen.contextauth.security.auth.ContextAuthProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Locale;

/**
 * Reverse geocoding against an OpenStreetMap Nominatim endpoint.
 */
@Slf4j
public class NominatimGeolocationResolver implements GeolocationResolver {

    private final ContextAuthProperties.Geolocation properties;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    public NominatimGeolocationResolver(ContextAuthProperties.Geolocation properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getTimeout())
                .build();
    }

    @Override
    public String resolve(double lat, double lon) {
        if (!properties.isEnabled()) {
            return UNKNOWN;
        }
        try {
            URI uri = URI.create(String.format(Locale.ROOT, "%s?format=json&lat=%f&lon=%f",
                    properties.getReverseUrl(), lat, lon));
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .timeout(properties.getTimeout())
                    .header("User-Agent", properties.getUserAgent())
                    .GET()
                    .build();
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.warn("reverse geocode returned status {}", response.statusCode());
                return UNKNOWN;
            }
            return parse(response.body());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return UNKNOWN;
        } catch (Exception ex) {
            log.warn("reverse geocode failed: {}", ex.getMessage());
            return UNKNOWN;
        }
    }

    String parse(String body) throws IOException {
        JsonNode name = objectMapper.readTree(body).path("display_name");
        if (name.isTextual() && !name.asText().isBlank()) {
            return name.asText();
        }
        return UNKNOWN;
    }
}
