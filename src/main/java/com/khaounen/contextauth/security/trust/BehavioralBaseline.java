package com.khaounen.contextauth.security.trust;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Set;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class BehavioralBaseline {

    /** Smoothed typing speed, {@code null} until the first sample arrives. */
    Double typingSpeed;

    @Builder.Default
    Set<Integer> typicalLoginHours = Set.of();

    public static BehavioralBaseline empty() {
        return BehavioralBaseline.builder().build();
    }
}
