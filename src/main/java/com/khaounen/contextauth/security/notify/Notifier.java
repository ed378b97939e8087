package com.khaounen.contextauth.security.notify;

import com.khaounen.contextauth.security.context.LoginContext;
import com.khaounen.contextauth.security.identity.UserIdentity;
import com.khaounen.contextauth.security.risk.RiskScore;

/**
 * Out-of-band messages to the account holder. Callers treat every method as
 * fire-and-forget; a failed delivery never changes a login decision.
 */
public interface Notifier {

    void sendVerificationCode(UserIdentity user, String code);

    void sendWelcome(UserIdentity user);

    void sendTwoFactorCode(UserIdentity user, String code, LoginContext context);

    void sendNewDeviceAlert(UserIdentity user, LoginContext context, String resetLink);

    void sendSuspiciousActivityAlert(UserIdentity user, LoginContext context, RiskScore score);

    void sendPasswordResetLink(UserIdentity user, String resetLink);

    void sendPasswordResetSuccess(UserIdentity user);
}
