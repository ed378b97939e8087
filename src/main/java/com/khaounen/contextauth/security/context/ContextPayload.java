package com.khaounen.contextauth.security.context;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw login signals as submitted by the client.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContextPayload {

    private String ip;
    private String device;
    private Location location;
    private Double typingSpeed;
    private Integer loginHour;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Location {
        private Double latitude;
        private Double longitude;
    }
}
