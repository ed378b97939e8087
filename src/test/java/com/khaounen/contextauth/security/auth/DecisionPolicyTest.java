package com.khaounen.contextauth.security.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DecisionPolicyTest {

    private final DecisionPolicy policy = new DecisionPolicy(5, 10);

    @Test
    void mapsScoresToOutcomesAtTheThresholds() {
        assertEquals(LoginOutcome.ALLOWED, policy.decide(0));
        assertEquals(LoginOutcome.ALLOWED, policy.decide(4));
        assertEquals(LoginOutcome.SECOND_FACTOR_REQUIRED, policy.decide(5));
        assertEquals(LoginOutcome.SECOND_FACTOR_REQUIRED, policy.decide(9));
        assertEquals(LoginOutcome.BLOCKED, policy.decide(10));
    }

    @Test
    void everyScoreFromTheBlockThresholdUpIsBlocked() {
        for (int score = 10; score <= 100; score++) {
            assertEquals(LoginOutcome.BLOCKED, policy.decide(score));
        }
    }

    @Test
    void rejectsInvertedThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new DecisionPolicy(10, 5));
        assertThrows(IllegalArgumentException.class, () -> new DecisionPolicy(5, 5));
    }
}
