package com.qgen.contract.model;

/**
 * Whether a successful authorization check dominates a call site, and what established it.
 */
public record AuthorizationFact(AuthorizationStatus status, Basis basis) {

    public enum Basis {
        NONE,
        /**
         * {@code is_owner}/{@code require_owner} style primitive, or the caller compared with a
         * literal or fixed-key stored identity
         */
        AUTHORIZATION_PRIMITIVE
    }

    public static final AuthorizationFact UNGUARDED = new AuthorizationFact(AuthorizationStatus.UNGUARDED, Basis.NONE);
    public static final AuthorizationFact AMBIGUOUS = new AuthorizationFact(AuthorizationStatus.AMBIGUOUS, Basis.NONE);

    public static AuthorizationFact guardedBy(Basis basis) {
        return new AuthorizationFact(AuthorizationStatus.GUARDED, basis);
    }

    public boolean isGuarded() {
        return status == AuthorizationStatus.GUARDED;
    }
}
