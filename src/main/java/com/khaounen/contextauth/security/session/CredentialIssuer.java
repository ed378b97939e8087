package com.khaounen.contextauth.security.session;

import java.util.Optional;

public interface CredentialIssuer {

    SessionCredential issueSession(String userId);

    Optional<SessionCredential> resolve(String sessionId);
}
