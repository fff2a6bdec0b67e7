package com.flagship.personal_ledger.security;

import java.util.Optional;
import java.util.UUID;

/**
 * Turns a bearer token into the owner id it was issued for.
 */
public interface OwnerTokenVerifier {

    /**
     * @return the owner id, or empty when the token is malformed, expired or not signed by us
     */
    Optional<UUID> verify(String token);
}
