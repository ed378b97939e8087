package com.khaounen.contextauth.security.identity;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Single-node store. {@link ConcurrentHashMap#compute} serializes updates per
 * user, so concurrent logins never lose trusted devices or IPs.
 */
public class InMemoryIdentityStore implements IdentityStore {

    private final Map<String, UserIdentity> identities = new ConcurrentHashMap<>();

    @Override
    public Optional<UserIdentity> find(String email) {
        return Optional.ofNullable(identities.get(email));
    }

    @Override
    public Optional<UserIdentity> findByResetToken(String token) {
        return identities.values().stream()
                .filter(identity -> identity.resetTokenMatching(token).isPresent())
                .findFirst();
    }

    @Override
    public boolean create(UserIdentity identity) {
        return identities.putIfAbsent(identity.getEmail(), identity) == null;
    }

    @Override
    public Optional<UserIdentity> update(String email, UnaryOperator<UserIdentity> mutation) {
        UserIdentity committed = identities.computeIfPresent(email, (key, current) -> {
            UserIdentity next = mutation.apply(current);
            if (next == current) {
                return current;
            }
            return next.toBuilder().version(current.getVersion() + 1).build();
        });
        return Optional.ofNullable(committed);
    }
}
