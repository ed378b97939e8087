package com.khaounen.contextauth.security.auth;

/**
 * Fixed thresholds mapping a risk score to an outcome.
 */
public class DecisionPolicy {

    private final int mfaThreshold;
    private final int blockThreshold;

    public DecisionPolicy(int mfaThreshold, int blockThreshold) {
        if (mfaThreshold < 0 || blockThreshold <= mfaThreshold) {
            throw new IllegalArgumentException(
                    "thresholds must satisfy 0 <= mfaThreshold < blockThreshold, got "
                            + mfaThreshold + " and " + blockThreshold);
        }
        this.mfaThreshold = mfaThreshold;
        this.blockThreshold = blockThreshold;
    }

    public LoginOutcome decide(int score) {
        if (score >= blockThreshold) {
            return LoginOutcome.BLOCKED;
        }
        if (score >= mfaThreshold) {
            return LoginOutcome.SECOND_FACTOR_REQUIRED;
        }
        return LoginOutcome.ALLOWED;
    }

    public int getMfaThreshold() {
        return mfaThreshold;
    }

    public int getBlockThreshold() {
        return blockThreshold;
    }
}
