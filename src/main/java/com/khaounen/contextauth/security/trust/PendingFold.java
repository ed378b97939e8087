package com.khaounen.contextauth.security.trust;

import com.khaounen.contextauth.security.context.LoginContext;

/**
 * A scored context waiting for its second factor before it may be folded.
 */
public record PendingFold(LoginContext context, String locationName, int riskScore) {
}
