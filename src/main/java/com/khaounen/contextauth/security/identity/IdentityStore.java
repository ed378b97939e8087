package com.khaounen.contextauth.security.identity;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable home of {@link UserIdentity} records keyed by normalized email.
 * Implementations throw {@link IdentityStoreException} when storage fails.
 */
public interface IdentityStore {

    Optional<UserIdentity> find(String email);

    Optional<UserIdentity> findByResetToken(String token);

    /**
     * @return {@code false} when a record for the email already exists
     */
    boolean create(UserIdentity identity);

    /**
     * Atomically applies {@code mutation} to the current record and bumps its
     * version. The mutation may run more than once if a concurrent writer wins,
     * so it must be free of side effects.
     *
     * @return the committed record, or empty when no record exists
     */
    Optional<UserIdentity> update(String email, UnaryOperator<UserIdentity> mutation);
}
